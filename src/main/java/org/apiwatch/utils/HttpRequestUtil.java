package org.apiwatch.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import java.io.InputStream;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Deque;
import java.util.Map;

/**
 * Parsing JSON, extracting fields, and path/query parameters
 */
public class HttpRequestUtil {

    private HttpRequestUtil() {}

    public static Map<String, Object> parseJson(HttpServerExchange exchange) {
        try (InputStream is = exchange.getInputStream()) {
            return JsonUtil.mapper().readValue(is, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            ResponseUtil.sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid JSON: " + e.getMessage());
            return null;
        }
    }

    public static String getString(Map<String, Object> body, String field) {
        Object value = body.get(field);
        return value != null ? value.toString() : null;
    }

    /**
     * Accepts JSON numbers and numeric strings.
     * @throws NumberFormatException when the value is present but not numeric
     */
    public static BigDecimal getDecimal(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) return null;
        if (value instanceof BigDecimal) return (BigDecimal) value;
        if (value instanceof Number) return new BigDecimal(value.toString());
        String text = value.toString().trim();
        return text.isEmpty() ? null : new BigDecimal(text);
    }

    /**
     * ISO-8601 instant or offset date-time; a local date-time (with 'T' or a space) is read as UTC.
     * @throws DateTimeParseException when the value is present but unparseable
     */
    public static Instant getInstant(Map<String, Object> body, String field) {
        String value = getString(body, field);
        if (value == null || value.isBlank()) return null;
        String text = value.trim().replace(' ', 'T');
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
    }

    /** Path template parameters land in the query parameter map. */
    public static String getParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }
}
