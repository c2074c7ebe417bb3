package org.endlesssource.mediastate.raw;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Lenient accessors for loosely typed server payloads. Missing, null, blank or
 * unparsable values read as empty.
 */
public final class JsonFields {
    /** Server ticks per second (100ns ticks). */
    public static final long TICKS_PER_SECOND = 10_000_000L;

    private JsonFields() {}

    /**
     * First non-blank value among the given fields, numbers rendered as text.
     */
    public static Optional<String> text(JsonNode node, String... fields) {
        for (String field : fields) {
            Optional<String> value = asText(child(node, field));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public static Optional<String> asText(JsonNode node) {
        if (isAbsent(node) || node.isContainerNode()) {
            return Optional.empty();
        }
        String value = node.asText();
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public static Optional<Integer> integer(JsonNode node, String... fields) {
        return longValue(node, fields).map(Long::intValue);
    }

    public static Optional<Long> longValue(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = child(node, field);
            if (isAbsent(value)) {
                continue;
            }
            if (value.isNumber()) {
                return Optional.of(value.asLong());
            }
            if (value.isTextual()) {
                String raw = value.asText().trim();
                try {
                    return Optional.of(Long.parseLong(raw));
                } catch (NumberFormatException ignored) {
                    // try the next field
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<Double> decimal(JsonNode node, String field) {
        JsonNode value = child(node, field);
        if (isAbsent(value)) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.asDouble());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException ex) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static boolean flag(JsonNode node, String field) {
        JsonNode value = child(node, field);
        if (isAbsent(value)) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return "true".equalsIgnoreCase(value.asText());
    }

    public static Optional<Boolean> optionalFlag(JsonNode node, String field) {
        JsonNode value = child(node, field);
        if (isAbsent(value)) {
            return Optional.empty();
        }
        return Optional.of(flag(node, field));
    }

    /**
     * Non-empty object under the first of the given fields that has one.
     */
    public static Optional<JsonNode> object(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = child(node, field);
            if (value != null && value.isObject() && !value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * Entries of a list payload: either a bare array or an object wrapping an {@code Items} array.
     */
    public static List<JsonNode> items(JsonNode payload) {
        JsonNode array = payload;
        if (payload != null && payload.isObject()) {
            array = payload.get("Items");
        }
        List<JsonNode> items = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(item -> {
                if (item.isObject()) {
                    items.add(item);
                }
            });
        }
        return items;
    }

    public static List<String> textList(JsonNode node, String field) {
        JsonNode value = child(node, field);
        List<String> values = new ArrayList<>();
        if (value == null) {
            return values;
        }
        if (value.isArray()) {
            value.forEach(element -> asText(element).ifPresent(values::add));
        } else {
            asText(value).ifPresent(values::add);
        }
        return values;
    }

    /**
     * ISO-8601 timestamp; values without an offset are read as UTC.
     */
    public static Optional<Instant> instant(JsonNode node, String field) {
        return text(node, field).flatMap(JsonFields::parseInstant);
    }

    public static Optional<Instant> parseInstant(String raw) {
        String value = raw.trim();
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ignored) {
            // no offset, try local
        }
        try {
            return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    /**
     * Tick count converted to a duration.
     */
    public static Optional<Duration> ticks(JsonNode node, String field) {
        JsonNode value = child(node, field);
        if (isAbsent(value) || !(value.isNumber() || value.isTextual())) {
            return Optional.empty();
        }
        Optional<Long> ticks = longValue(node, field);
        if (ticks.isEmpty() && value.isNumber()) {
            ticks = Optional.of((long) value.asDouble());
        }
        return ticks.map(count -> Duration.ofNanos(count * 100L));
    }

    /**
     * Bitrate in bits per second. Accepts plain numbers and text such as {@code "4000kbps"} or {@code "8 Mbps"}.
     */
    public static Optional<Long> bitrate(JsonNode node, String field) {
        JsonNode value = child(node, field);
        if (isAbsent(value)) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.asLong());
        }
        if (value.isTextual()) {
            return parseBitrate(value.asText());
        }
        return Optional.empty();
    }

    public static Optional<Long> parseBitrate(String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT).replace(" ", "");
        long multiplier = 1L;
        if (value.endsWith("kbps")) {
            multiplier = 1_000L;
            value = value.substring(0, value.length() - 4);
        } else if (value.endsWith("mbps")) {
            multiplier = 1_000_000L;
            value = value.substring(0, value.length() - 4);
        } else if (value.endsWith("bps")) {
            value = value.substring(0, value.length() - 3);
        }
        try {
            return Optional.of(Math.round(Double.parseDouble(value) * multiplier));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static JsonNode child(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        return node.get(field);
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }
}
