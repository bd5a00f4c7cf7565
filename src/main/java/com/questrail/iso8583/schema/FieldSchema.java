package com.questrail.iso8583.schema;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * FieldSchema
 * =============================================================================
 * Immutable mapping from ISO 8583 field number (0-128) to its {@link FieldRule}.
 *
 * <h2>Structural invariants</h2>
 * A schema can only be constructed when:
 * <ul>
 *   <li>it holds at least one rule</li>
 *   <li>field 0 (MTI) and field 1 (bitmap) are present as {@code fixed} rules
 *       with a positive width</li>
 *   <li>the bitmap width is an even number of hex characters no wider than a
 *       full primary + secondary bitmap (32)</li>
 *   <li>every field number lies in 0-128</li>
 * </ul>
 *
 * <p>Holding a {@code FieldSchema} is therefore the "loaded" state: codecs
 * require one at construction and there is no process-wide schema. Replacing
 * a schema means constructing a new codec.</p>
 */
public final class FieldSchema
{
    public static final int MTI_FIELD = 0;
    public static final int BITMAP_FIELD = 1;
    public static final int MAX_FIELD = 128;

    /** Hex characters in a primary plus secondary bitmap. */
    public static final int MAX_BITMAP_HEX_LENGTH = 32;

    private final SortedMap<Integer, FieldRule> rules;

    private FieldSchema(SortedMap<Integer, FieldRule> rules) {
        this.rules = Collections.unmodifiableSortedMap(new TreeMap<>(rules));
    }

    /**
     * Returns the rule for {@code field}, if configured.
     */
    public Optional<FieldRule> rule(int field) {
        return Optional.ofNullable(rules.get(field));
    }

    public FieldRule mtiRule() {
        return rules.get(MTI_FIELD);
    }

    public FieldRule bitmapRule() {
        return rules.get(BITMAP_FIELD);
    }

    public SortedMap<Integer, FieldRule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "FieldSchema[fields=" + rules.keySet() + "]";
    }

    public static final class Builder {
        private final SortedMap<Integer, FieldRule> rules = new TreeMap<>();

        public Builder field(int field, FieldRule rule) {
            if (field < MTI_FIELD || field > MAX_FIELD) {
                throw new IllegalArgumentException(
                        "Field number must be in range " + MTI_FIELD + "-" + MAX_FIELD + " (was " + field + ")");
            }
            rules.put(field, Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public FieldSchema build() {
            if (rules.isEmpty()) {
                throw new IllegalArgumentException("Field schema must define at least one field");
            }
            requireFixed(MTI_FIELD, "MTI");
            FieldRule bitmap = requireFixed(BITMAP_FIELD, "bitmap");
            if (bitmap.maxLen() % 2 != 0 || bitmap.maxLen() > MAX_BITMAP_HEX_LENGTH) {
                throw new IllegalArgumentException(
                        "Bitmap field width must be an even number of hex characters up to "
                                + MAX_BITMAP_HEX_LENGTH + " (was " + bitmap.maxLen() + ")");
            }
            return new FieldSchema(rules);
        }

        private FieldRule requireFixed(int field, String name) {
            FieldRule rule = rules.get(field);
            if (rule == null) {
                throw new IllegalArgumentException("Field schema is missing field " + field + " (" + name + ")");
            }
            if (rule.resolvedLengthType().orElse(null) != LengthType.FIXED) {
                throw new IllegalArgumentException(
                        "Field " + field + " (" + name + ") must be fixed length (was " + rule.lengthType() + ")");
            }
            if (rule.maxLen() <= 0) {
                throw new IllegalArgumentException("Field " + field + " (" + name + ") must have a positive width");
            }
            return rule;
        }
    }
}
