package edustats.oecd.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One decoded observation: dimension name to dimension value, plus the
 * observation value under {@link #VALUE_KEY}.
 *
 * Keys keep insertion order and are whatever dimensions the payload
 * declares. Record cleaners turn it into a typed {@link CleanRecord};
 * nothing downstream of them sees a FlatRecord.
 */
public final class FlatRecord {

    public static final String VALUE_KEY = "value";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public FlatRecord() {
    }

    public FlatRecord put(String name, Object value) {
        fields.put(Objects.requireNonNull(name, "name"), value);
        return this;
    }

    public Object get(String name) {
        return fields.get(name);
    }

    /** Read-only view in insertion order */
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlatRecord)) return false;
        return fields.equals(((FlatRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "FlatRecord" + fields;
    }
}
