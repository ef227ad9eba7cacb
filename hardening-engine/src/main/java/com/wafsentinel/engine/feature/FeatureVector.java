package com.wafsentinel.engine.feature;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;

/**
 * Fixed-order numeric representation of one audit record.
 *
 * <p>
 * Instances are immutable; {@link #values()} returns a copy.
 * </p>
 *
 * @author WAF Sentinel Team
 */
public final class FeatureVector {

    private final FeatureSchema schema;
    private final double[] values;

    FeatureVector(FeatureSchema schema, double[] values) {
        if (values.length != schema.size()) {
            throw new IllegalArgumentException(
                    "Vector has " + values.length + " slots, schema " + schema.version() + " expects " + schema.size());
        }
        this.schema = schema;
        this.values = values.clone();
    }

    /** Build a vector directly from slot values, e.g. for replaying stored features. */
    public static FeatureVector of(FeatureSchema schema, double[] values) {
        return new FeatureVector(schema, values);
    }

    public String schemaVersion() {
        return schema.version();
    }

    public List<String> names() {
        return schema.names();
    }

    public int size() {
        return values.length;
    }

    public double get(int slot) {
        return values[slot];
    }

    /**
     * Value of a named feature.
     *
     * @throws IllegalArgumentException if the schema has no such feature
     */
    public double get(String name) {
        OptionalInt slot = schema.slotOf(name);
        if (slot.isEmpty()) {
            throw new IllegalArgumentException("Unknown feature: " + name);
        }
        return values[slot.getAsInt()];
    }

    public double[] values() {
        return values.clone();
    }

    /**
     * Canonical binary form: UTF-8 schema version length and bytes, then each slot
     * as a big-endian IEEE-754 double.
     */
    public byte[] toByteArray() {
        byte[] version = schema.version().getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(Integer.BYTES + version.length + values.length * Double.BYTES);
        buf.putInt(version.length);
        buf.put(version);
        for (double value : values) {
            buf.putDouble(value);
        }
        return buf.array();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureVector other)) {
            return false;
        }
        return schema.version().equals(other.schema.version()) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * schema.version().hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector[" + schema.version() + ", " + values.length + " slots]";
    }
}
