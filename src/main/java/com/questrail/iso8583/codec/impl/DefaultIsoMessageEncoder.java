package com.questrail.iso8583.codec.impl;

import com.questrail.iso8583.codec.IsoEncodeException;
import com.questrail.iso8583.codec.IsoMessageEncoder;
import com.questrail.iso8583.codec.MissingFieldConfigException;
import com.questrail.iso8583.codec.UnsupportedLengthTypeException;
import com.questrail.iso8583.schema.FieldRule;
import com.questrail.iso8583.schema.FieldSchema;
import com.questrail.iso8583.schema.LengthType;

import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * DefaultIsoMessageEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link IsoMessageEncoder}.
 *
 * <p>Output layout: MTI verbatim, uppercase bitmap hex (8 or 16 bytes), then
 * every present field from 2 to 128 in ascending order:</p>
 * <ul>
 *   <li>{@code fixed}: fitted to {@code maxLen} by {@link FieldPadding}</li>
 *   <li>{@code llvar} / {@code lllvar}: zero-padded value length, then the
 *       value unchanged. {@code maxLen} is not enforced.</li>
 * </ul>
 *
 * <p>Any value stored under field 1 is ignored.</p>
 */
public final class DefaultIsoMessageEncoder implements IsoMessageEncoder
{
    private final FieldSchema schema;

    public DefaultIsoMessageEncoder(FieldSchema schema)
    {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    @Override
    public String encode(SortedMap<Integer, String> fields)
    {
        Objects.requireNonNull(fields, "fields");

        if (fields.isEmpty()) {
            throw new IsoEncodeException("Cannot compose a message with no fields");
        }
        final String mti = fields.get(FieldSchema.MTI_FIELD);
        if (mti == null) {
            throw new IsoEncodeException("Cannot compose a message without an MTI (field 0)");
        }
        if (fields.firstKey() < FieldSchema.MTI_FIELD || fields.lastKey() > FieldSchema.MAX_FIELD) {
            throw new IsoEncodeException("Field numbers must be in range 0-128: " + fields.keySet());
        }

        final StringBuilder out = new StringBuilder(128);
        out.append(mti);
        out.append(Bitmap.toHex(Bitmap.forFields(fields.keySet())));

        for (Map.Entry<Integer, String> entry : fields.tailMap(2).entrySet()) {
            final int f = entry.getKey();
            final String value = entry.getValue();

            FieldRule rule = schema.rule(f).orElseThrow(() -> new MissingFieldConfigException(f));
            LengthType type = rule.resolvedLengthType()
                    .orElseThrow(() -> new UnsupportedLengthTypeException(f, rule.lengthType()));

            if (type == LengthType.FIXED) {
                out.append(FieldPadding.fit(value, rule.maxLen(), rule.isNumeric()));
                continue;
            }

            if (value.length() > type.maxPrefixedLength()) {
                throw new IsoEncodeException(String.format(
                        "Field %d value length %d exceeds %s prefix capacity %d",
                        f, value.length(), type.configName(), type.maxPrefixedLength()));
            }
            out.append(FieldPadding.lengthPrefix(value.length(), type.prefixDigits()));
            out.append(value);
        }

        return out.toString();
    }
}
