package org.endlesssource.mediastate.aggregate;

import java.util.List;
import java.util.Optional;

public record MultisessionUsers(List<UserSessions> users) {
    public MultisessionUsers {
        users = List.copyOf(users);
    }

    public int count() {
        return users.size();
    }

    public Optional<UserSessions> find(String user) {
        return users.stream().filter(entry -> entry.user().equals(user)).findFirst();
    }
}
