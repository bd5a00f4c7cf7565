package com.questrail.iso8583.codec.impl;

import com.questrail.iso8583.codec.IsoDecodeException;

import java.util.Collection;
import java.util.HexFormat;

/**
 * Bitmap
 * -----------------------------------------------------------------------------
 * Bit arithmetic for ISO 8583 field presence bitmaps.
 *
 * <p>Field {@code f} is represented by byte {@code (f - 1) / 8}, bit
 * {@code 7 - ((f - 1) % 8)} counting from the most significant bit. Bit 1
 * of the primary bitmap signals that a secondary bitmap (fields 65-128)
 * follows.</p>
 */
final class Bitmap
{
    static final int PRIMARY_BYTES = 8;
    static final int FULL_BYTES = 16;
    static final int SECONDARY_FLAG_FIELD = 1;
    static final int LAST_PRIMARY_FIELD = 64;

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private Bitmap() {}

    /**
     * Returns true if {@code field} is flagged in {@code bitmap}. Fields beyond
     * the end of the bitmap are reported absent.
     */
    static boolean isSet(byte[] bitmap, int field)
    {
        final int byteIndex = (field - 1) / 8;
        if (byteIndex >= bitmap.length) {
            return false;
        }
        return (bitmap[byteIndex] & mask(field)) != 0;
    }

    static void set(byte[] bitmap, int field)
    {
        bitmap[(field - 1) / 8] |= mask(field);
    }

    /**
     * Builds the bitmap for a set of present field numbers.
     *
     * <p>A secondary bitmap is used only when some field above 64 is present,
     * in which case bit 1 is forced on. Fields 0 and 1 are never flagged
     * directly.</p>
     */
    static byte[] forFields(Collection<Integer> fields)
    {
        int highest = 0;
        for (int f : fields) {
            highest = Math.max(highest, f);
        }

        final boolean secondary = highest > LAST_PRIMARY_FIELD;
        final byte[] bitmap = new byte[secondary ? FULL_BYTES : PRIMARY_BYTES];

        if (secondary) {
            set(bitmap, SECONDARY_FLAG_FIELD);
        }
        for (int f : fields) {
            if (f > SECONDARY_FLAG_FIELD) {
                set(bitmap, f);
            }
        }
        return bitmap;
    }

    static String toHex(byte[] bytes)
    {
        return HEX.formatHex(bytes);
    }

    /**
     * Decodes hexadecimal text (either case).
     *
     * @throws IsoDecodeException on odd length or a non-hex character
     */
    static byte[] fromHex(String hex)
    {
        try {
            return HEX.parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new IsoDecodeException("Bitmap is not valid hexadecimal: '" + hex + "'", e);
        }
    }

    private static int mask(int field)
    {
        return 1 << (7 - ((field - 1) % 8));
    }
}
