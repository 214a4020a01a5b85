package com.wellstim.extraction.model;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized values for one entity, keyed by entity property name. A key
 * mapped to null is a field that was looked for but not found.
 */
public class ParsedRecord extends LinkedHashMap<String, Object> {

    public ParsedRecord() {
        super();
    }

    public ParsedRecord(Map<String, ?> values) {
        super(values);
    }

    public String getString(String key) {
        Object value = get(key);
        return value == null ? null : String.valueOf(value);
    }

    public Double getDouble(String key) {
        Object value = get(key);
        return value == null ? null : ((Number) value).doubleValue();
    }

    public Integer getInteger(String key) {
        Object value = get(key);
        return value == null ? null : ((Number) value).intValue();
    }

    public LocalDate getDate(String key) {
        return (LocalDate) get(key);
    }

    public boolean isPresent(String key) {
        Object value = get(key);
        return value != null && !"".equals(value);
    }

    /**
     * Copy holding only the present values, in the same order.
     */
    public ParsedRecord withoutMissing() {
        ParsedRecord payload = new ParsedRecord();
        forEach((key, value) -> {
            if (value != null && !"".equals(value)) {
                payload.put(key, value);
            }
        });
        return payload;
    }

    public long presentCount() {
        return keySet().stream().filter(this::isPresent).count();
    }
}
