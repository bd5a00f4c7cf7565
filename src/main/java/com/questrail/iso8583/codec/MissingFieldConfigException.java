package com.questrail.iso8583.codec;

/**
 * A field is present in a message (by bitmap on parse, by value on compose)
 * but the schema has no rule for it.
 */
public final class MissingFieldConfigException extends IsoCodecException
{
    private final int field;

    public MissingFieldConfigException(int field) {
        super("No schema rule configured for field " + field);
        this.field = field;
    }

    public int field() {
        return field;
    }
}
