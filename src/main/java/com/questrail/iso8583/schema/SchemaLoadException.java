package com.questrail.iso8583.schema;

/**
 * Indicates that a field schema document could not be read or does not
 * describe a valid {@link FieldSchema}.
 *
 * <p>This is the only checked exception in the codec stack: a schema that
 * fails to load is fatal to startup and callers are expected to handle it
 * there.</p>
 */
public final class SchemaLoadException extends Exception
{
    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
