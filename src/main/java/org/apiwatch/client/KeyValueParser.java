package org.apiwatch.client;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the "key: value" line format accepted for params and headers.
 * <pre>
 * page: 2
 * verbose: true
 * q: status: open
 * </pre>
 * yields {@code {page=2, verbose=true, q="status: open"}}. Lines without a colon or with an empty key are ignored.
 */
public final class KeyValueParser {

    private KeyValueParser() {}

    public static Map<String, Object> parse(String text) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (text == null || text.isBlank()) return result;

        for (String line : text.strip().split("\\R")) {
            int colon = line.indexOf(':');
            if (colon < 0) continue;
            String key = line.substring(0, colon).strip();
            if (key.isEmpty()) continue;
            result.put(key, coerce(line.substring(colon + 1).strip()));
        }
        return result;
    }

    static Object coerce(String value) {
        if (!value.isEmpty() && value.chars().allMatch(Character::isDigit)) {
            try {
                long number = Long.parseLong(value);
                if (number <= Integer.MAX_VALUE) return (int) number;
                return number;
            } catch (NumberFormatException tooLarge) {
                return value;
            }
        }
        if ("true".equalsIgnoreCase(value)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(value)) return Boolean.FALSE;
        return value;
    }
}
