package com.questrail.iso8583.schema;

import java.util.Locale;
import java.util.Optional;

/**
 * How the extent of a field is determined on the wire.
 */
public enum LengthType
{
    /** Exactly {@code maxLen} characters, padded or truncated on compose. */
    FIXED("fixed", 0),

    /** Two decimal digits of length followed by the value. */
    LLVAR("llvar", 2),

    /** Three decimal digits of length followed by the value. */
    LLLVAR("lllvar", 3);

    private final String configName;
    private final int prefixDigits;

    LengthType(String configName, int prefixDigits) {
        this.configName = configName;
        this.prefixDigits = prefixDigits;
    }

    /**
     * Name used for this length type in schema documents.
     */
    public String configName() {
        return configName;
    }

    /**
     * Number of decimal digits in the length prefix; zero for {@link #FIXED}.
     */
    public int prefixDigits() {
        return prefixDigits;
    }

    /**
     * Largest value length the prefix can express.
     */
    public int maxPrefixedLength() {
        int max = 1;
        for (int i = 0; i < prefixDigits; i++) {
            max *= 10;
        }
        return max - 1;
    }

    /**
     * Resolves a configured length type name, ignoring case and surrounding
     * whitespace.
     *
     * @return the matching length type, or empty if the name is not recognised
     */
    public static Optional<LengthType> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.strip().toLowerCase(Locale.ROOT);
        for (LengthType type : values()) {
            if (type.configName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
