package com.questrail.iso8583.codec;

/**
 * Base type for failures raised while parsing or composing an ISO 8583
 * message.
 *
 * <p>Codec failures are scoped to the single message being processed. They
 * never reflect a problem with the schema as a whole, which is validated when
 * it is built.</p>
 */
public class IsoCodecException extends RuntimeException
{
    public IsoCodecException(String message) {
        super(message);
    }

    public IsoCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
