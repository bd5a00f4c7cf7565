package com.questrail.iso8583.core;

import com.questrail.iso8583.api.IsoMessage;
import com.questrail.iso8583.codec.IsoMessageDecoder;
import com.questrail.iso8583.codec.IsoMessageEncoder;
import com.questrail.iso8583.codec.impl.DefaultIsoMessageDecoder;
import com.questrail.iso8583.codec.impl.DefaultIsoMessageEncoder;
import com.questrail.iso8583.schema.FieldSchema;

import java.util.Objects;

/**
 * Creates empty {@link IsoMessage} instances bound to one {@link FieldSchema}.
 *
 * <p>The decoder and encoder are stateless and shared by every message the
 * factory creates.</p>
 */
public final class IsoMessageFactory
{
    private final FieldSchema schema;
    private final IsoMessageDecoder decoder;
    private final IsoMessageEncoder encoder;

    public IsoMessageFactory(FieldSchema schema) {
        this(schema, new DefaultIsoMessageDecoder(schema), new DefaultIsoMessageEncoder(schema));
    }

    public IsoMessageFactory(FieldSchema schema, IsoMessageDecoder decoder, IsoMessageEncoder encoder) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
    }

    public IsoMessage newMessage() {
        return new DefaultIsoMessage(decoder, encoder);
    }

    /**
     * Convenience for {@code newMessage()} followed by {@code parse(raw)}.
     */
    public IsoMessage parse(String raw) {
        IsoMessage message = newMessage();
        message.parse(raw);
        return message;
    }

    public FieldSchema schema() {
        return schema;
    }
}
