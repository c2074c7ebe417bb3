package org.endlesssource.mediastate.session;

import org.endlesssource.mediastate.api.ClassifiedSession;
import org.endlesssource.mediastate.api.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Assigns stable entity keys to sessions from their (device, user) pair.
 * The key table is written only by {@link #reconcile}, which the session poll cycle calls.
 */
public final class SessionIdentityManager {
    private static final Logger logger = LoggerFactory.getLogger(SessionIdentityManager.class);
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final String UNKNOWN_DEVICE = "unknown_device";

    private final String keyPrefix;
    private final Map<String, String> serverSessionIds = new ConcurrentHashMap<>();

    public SessionIdentityManager(String keyPrefix) {
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix must not be null");
    }

    /**
     * Key the sessions of one poll and diff them against the previous poll.
     * Sessions sharing a key merge, the later one winning.
     */
    public SessionSnapshot reconcile(List<ClassifiedSession> sessions, Instant polledAt) {
        Map<String, ClassifiedSession> current = new LinkedHashMap<>();
        for (ClassifiedSession session : sessions) {
            String key = keyFor(session.deviceName(), session.userName());
            if (current.put(key, session) != null) {
                logger.debug("Merged concurrent sessions for key {}", key);
            }
        }

        Set<String> previous = Set.copyOf(serverSessionIds.keySet());
        Set<String> added = new LinkedHashSet<>();
        for (String key : current.keySet()) {
            if (!previous.contains(key)) {
                added.add(key);
            }
        }
        Set<String> removed = new LinkedHashSet<>();
        for (String key : previous) {
            if (!current.containsKey(key)) {
                removed.add(key);
            }
        }

        serverSessionIds.keySet().removeAll(removed);
        current.forEach((key, session) -> {
            if (session.serverSessionId() != null) {
                serverSessionIds.put(key, session.serverSessionId());
            } else {
                serverSessionIds.putIfAbsent(key, "");
            }
        });
        if (!added.isEmpty() || !removed.isEmpty()) {
            logger.debug("Session keys added={} removed={}", added, removed);
        }
        return new SessionSnapshot(polledAt, current, added, removed);
    }

    /**
     * Server-assigned id of the session currently published under a key.
     */
    public Optional<String> serverSessionId(String key) {
        return Optional.ofNullable(serverSessionIds.get(key)).filter(id -> !id.isEmpty());
    }

    public boolean isKnown(String key) {
        return serverSessionIds.containsKey(key);
    }

    public Set<String> activeKeys() {
        return Set.copyOf(serverSessionIds.keySet());
    }

    /**
     * Forget every key, e.g. after the session category was torn down.
     */
    public void clear() {
        serverSessionIds.clear();
    }

    public String keyFor(String deviceName, String userName) {
        return keyFor(keyPrefix, deviceName, userName);
    }

    /**
     * Deterministic key from prefix, device and optional user.
     */
    public static String keyFor(String prefix, String deviceName, String userName) {
        StringBuilder key = new StringBuilder();
        String prefixToken = slug(prefix);
        if (!prefixToken.isEmpty()) {
            key.append(prefixToken).append('_');
        }
        String device = slug(deviceName);
        key.append(device.isEmpty() ? UNKNOWN_DEVICE : device);
        String user = slug(userName);
        if (!user.isEmpty()) {
            key.append('_').append(user);
        }
        return key.toString();
    }

    static String slug(String value) {
        if (value == null) {
            return "";
        }
        String ascii = DIACRITICS.matcher(Normalizer.normalize(value, Normalizer.Form.NFKD)).replaceAll("");
        String token = NON_ALPHANUMERIC.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("_");
        int start = 0;
        int end = token.length();
        while (start < end && token.charAt(start) == '_') {
            start++;
        }
        while (end > start && token.charAt(end - 1) == '_') {
            end--;
        }
        return token.substring(start, end);
    }
}
