package com.questrail.iso8583.codec.impl;

import com.questrail.iso8583.codec.IsoDecodeException;
import com.questrail.iso8583.codec.IsoMessageDecoder;
import com.questrail.iso8583.codec.MissingFieldConfigException;
import com.questrail.iso8583.codec.UnsupportedLengthTypeException;
import com.questrail.iso8583.schema.FieldRule;
import com.questrail.iso8583.schema.FieldSchema;
import com.questrail.iso8583.schema.LengthType;

import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * DefaultIsoMessageDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link IsoMessageDecoder}.
 *
 * <p>This decoder performs the following steps, in order, with a single
 * cursor over the input:</p>
 * <ol>
 *   <li>MTI: {@code schema[0].maxLen} characters</li>
 *   <li>Bitmap: {@code schema[1].maxLen} hex characters</li>
 *   <li>Secondary bitmap, if flagged and not already read</li>
 *   <li>Fields 2-128 in ascending order, for every bit that is set</li>
 * </ol>
 *
 * <p><strong>Secondary bitmap policy:</strong> when bit 1 is set and the
 * configured bitmap width covers fewer than 16 bytes, the hex characters
 * needed to complete a 16-byte bitmap are read immediately after it. A
 * schema configured with a 32-character bitmap reads both halves up front.
 * When bit 1 is clear, fields beyond the decoded bitmap are absent. Field 1
 * holds every bitmap character that was read.</p>
 *
 * <p>Characters after the last present field are ignored.</p>
 */
public final class DefaultIsoMessageDecoder implements IsoMessageDecoder
{
    private final FieldSchema schema;

    public DefaultIsoMessageDecoder(FieldSchema schema)
    {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    @Override
    public SortedMap<Integer, String> decode(String raw)
    {
        Objects.requireNonNull(raw, "raw");

        final Cursor cursor = new Cursor(raw);
        final SortedMap<Integer, String> fields = new TreeMap<>();

        // 1) MTI
        fields.put(FieldSchema.MTI_FIELD, cursor.take(schema.mtiRule().maxLen(), "MTI"));

        // 2) Primary bitmap (or full bitmap, depending on configured width)
        String bitmapHex = cursor.take(schema.bitmapRule().maxLen(), "bitmap");
        byte[] bitmap = Bitmap.fromHex(bitmapHex);

        // 3) Secondary bitmap when flagged and not yet covered
        if (Bitmap.isSet(bitmap, Bitmap.SECONDARY_FLAG_FIELD) && bitmap.length < Bitmap.FULL_BYTES) {
            String secondaryHex = cursor.take((Bitmap.FULL_BYTES - bitmap.length) * 2, "secondary bitmap");
            bitmapHex = bitmapHex + secondaryHex;
            bitmap = Bitmap.fromHex(bitmapHex);
        }
        fields.put(FieldSchema.BITMAP_FIELD, bitmapHex);

        // 4) Data fields
        for (int field = 2; field <= FieldSchema.MAX_FIELD; field++) {
            if (!Bitmap.isSet(bitmap, field)) {
                continue;
            }
            final int f = field;
            FieldRule rule = schema.rule(f).orElseThrow(() -> new MissingFieldConfigException(f));
            LengthType type = rule.resolvedLengthType()
                    .orElseThrow(() -> new UnsupportedLengthTypeException(f, rule.lengthType()));

            final String value;
            if (type == LengthType.FIXED) {
                value = cursor.take(rule.maxLen(), "field " + f);
            } else {
                int length = cursor.takeLength(type.prefixDigits(), f);
                value = cursor.take(length, "field " + f);
            }
            fields.put(f, value);
        }

        return fields;
    }

    /**
     * Left-to-right read position over the raw message.
     */
    private static final class Cursor
    {
        private final String raw;
        private int pos;

        Cursor(String raw)
        {
            this.raw = raw;
        }

        String take(int count, String what)
        {
            if (count > raw.length() - pos) {
                throw new IsoDecodeException(String.format(
                        "Message truncated reading %s: need %d characters at offset %d, %d available",
                        what, count, pos, raw.length() - pos));
            }
            String s = raw.substring(pos, pos + count);
            pos += count;
            return s;
        }

        int takeLength(int digits, int field)
        {
            String prefix = take(digits, "length prefix of field " + field);
            for (int i = 0; i < prefix.length(); i++) {
                if (prefix.charAt(i) < '0' || prefix.charAt(i) > '9') {
                    throw new IsoDecodeException(
                            "Length prefix of field " + field + " is not decimal: '" + prefix + "'");
                }
            }
            return Integer.parseInt(prefix);
        }
    }
}
