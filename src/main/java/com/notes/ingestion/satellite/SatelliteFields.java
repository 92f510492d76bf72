package com.notes.ingestion.satellite;

import com.notes.ingestion.core.model.Values;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read access to an untyped satellite record, with dotted paths such as {@code jurisdiction.country}.
 */
public final class SatelliteFields {

    private final Map<String, Object> values;

    public SatelliteFields(Map<String, Object> values) {
        this.values = values != null ? new LinkedHashMap<>(values) : new LinkedHashMap<>();
    }

    public String text(String path) {
        Object value = resolve(path);
        return value == null ? null : value.toString();
    }

    public boolean has(String path) {
        Object value = resolve(path);
        if (value instanceof String s) {
            return Values.hasText(s);
        }
        return value != null;
    }

    public SatelliteFields with(String field, Object value) {
        SatelliteFields copy = new SatelliteFields(values);
        copy.values.put(field, value);
        return copy;
    }

    public Map<String, Object> asMap() {
        return new LinkedHashMap<>(values);
    }

    private Object resolve(String path) {
        Object current = values;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
        }
        return current;
    }
}
