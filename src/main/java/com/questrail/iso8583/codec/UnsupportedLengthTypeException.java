package com.questrail.iso8583.codec;

/**
 * The schema rule for a field names a length type other than
 * {@code fixed}, {@code llvar} or {@code lllvar}.
 */
public final class UnsupportedLengthTypeException extends IsoCodecException
{
    private final int field;
    private final String lengthType;

    public UnsupportedLengthTypeException(int field, String lengthType) {
        super("Unsupported length type '" + lengthType + "' for field " + field);
        this.field = field;
        this.lengthType = lengthType;
    }

    public int field() {
        return field;
    }

    public String lengthType() {
        return lengthType;
    }
}
