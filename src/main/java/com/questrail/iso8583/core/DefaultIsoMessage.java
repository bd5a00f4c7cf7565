package com.questrail.iso8583.core;

import com.questrail.iso8583.api.IsoMessage;
import com.questrail.iso8583.codec.IsoMessageDecoder;
import com.questrail.iso8583.codec.IsoMessageEncoder;
import com.questrail.iso8583.schema.FieldSchema;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The single {@link IsoMessage} implementation, backed by a sorted map and
 * delegating wire work to a decoder/encoder pair bound to one schema.
 */
public final class DefaultIsoMessage implements IsoMessage
{
    private final IsoMessageDecoder decoder;
    private final IsoMessageEncoder encoder;

    private SortedMap<Integer, String> fields = new TreeMap<>();

    DefaultIsoMessage(IsoMessageDecoder decoder, IsoMessageEncoder encoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
    }

    @Override
    public void parse(String raw) {
        // Decode fully before touching state so a failed parse leaves no partial content.
        SortedMap<Integer, String> decoded = decoder.decode(raw);
        this.fields = new TreeMap<>(decoded);
    }

    @Override
    public String compose() {
        return encoder.encode(Collections.unmodifiableSortedMap(fields));
    }

    @Override
    public String getField(int field) {
        return fields.getOrDefault(field, "");
    }

    @Override
    public void setField(int field, Object value) {
        checkFieldNumber(field);
        Objects.requireNonNull(value, "value");
        fields.put(field, String.valueOf(value));
    }

    @Override
    public boolean hasField(int field) {
        return fields.containsKey(field);
    }

    @Override
    public void unsetField(int field) {
        fields.remove(field);
    }

    @Override
    public String getMti() {
        return getField(FieldSchema.MTI_FIELD);
    }

    @Override
    public void setMti(String mti) {
        setField(FieldSchema.MTI_FIELD, mti);
    }

    @Override
    public void clear() {
        fields = new TreeMap<>();
    }

    @Override
    public SortedMap<Integer, String> fields() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(fields));
    }

    @Override
    public String prettyPrint() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, String> e : fields.entrySet()) {
            sb.append(String.format("[%03d][%s]\n", e.getKey(), e.getValue()));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "IsoMessage[mti=" + getMti() + ", fields=" + fields.keySet() + "]";
    }

    private static void checkFieldNumber(int field) {
        if (field < FieldSchema.MTI_FIELD || field > FieldSchema.MAX_FIELD) {
            throw new IllegalArgumentException(
                    "ISO 8583 field number must be in range " + FieldSchema.MTI_FIELD
                            + "-" + FieldSchema.MAX_FIELD + " (was " + field + ")");
        }
    }
}
