package com.questrail.iso8583.schema;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Encoding rule for a single ISO 8583 field.
 *
 * <p>The length type is kept exactly as configured. A rule whose length type
 * is not one of {@code fixed}, {@code llvar} or {@code lllvar} is still a
 * valid schema entry; the codec rejects it only when a message actually
 * carries that field.</p>
 *
 * @param contentType content tag; {@code "n"} marks numeric content
 * @param label       human-readable field name, descriptive only
 * @param lengthType  configured length type name
 * @param maxLen      exact width for fixed fields, maximum payload otherwise
 */
public record FieldRule(
        String contentType,
        String label,
        String lengthType,
        int maxLen
) {
    /** Content type tag for numeric fields. */
    public static final String NUMERIC = "n";

    public FieldRule {
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(lengthType, "lengthType");
        label = (label == null) ? "" : label;
        if (maxLen < 0) {
            throw new IllegalArgumentException("maxLen must not be negative (was " + maxLen + ")");
        }
    }

    public static FieldRule fixed(String contentType, int maxLen, String label) {
        return new FieldRule(contentType, label, LengthType.FIXED.configName(), maxLen);
    }

    public static FieldRule llvar(String contentType, int maxLen, String label) {
        return new FieldRule(contentType, label, LengthType.LLVAR.configName(), maxLen);
    }

    public static FieldRule lllvar(String contentType, int maxLen, String label) {
        return new FieldRule(contentType, label, LengthType.LLLVAR.configName(), maxLen);
    }

    /**
     * Numeric fields are left-padded with {@code '0'} on compose.
     */
    public boolean isNumeric() {
        return NUMERIC.equals(contentType.strip().toLowerCase(Locale.ROOT));
    }

    public Optional<LengthType> resolvedLengthType() {
        return LengthType.fromConfigName(lengthType);
    }
}
