package org.endlesssource.mediastate.publish;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered attribute map that drops absent values.
 */
final class Attributes {
    private final Map<String, Object> values = new LinkedHashMap<>();

    Attributes put(String name, Object value) {
        if (value == null) {
            return this;
        }
        if (value instanceof String text && text.isBlank()) {
            return this;
        }
        if (value instanceof Collection<?> collection && collection.isEmpty()) {
            return this;
        }
        values.put(name, value);
        return this;
    }

    Map<String, Object> build() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
