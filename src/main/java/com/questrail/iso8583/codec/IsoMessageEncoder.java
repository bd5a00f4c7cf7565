package com.questrail.iso8583.codec;

import java.util.SortedMap;

/**
 * IsoMessageEncoder
 * -----------------------------------------------------------------------------
 * Text-level encoder for ISO 8583 message bodies.
 *
 * <p>This is the mechanical inverse of {@link IsoMessageDecoder} with one
 * deliberate asymmetry: field 1 is never taken from the supplied values. The
 * bitmap is always recomputed from the set of present field numbers.</p>
 */
public interface IsoMessageEncoder
{
    /**
     * Compose a message body (without its length prefix).
     *
     * @throws IsoEncodeException if no fields are present, the MTI is absent or
     *         a variable-length value does not fit its length prefix
     * @throws MissingFieldConfigException if a present field has no rule
     * @throws UnsupportedLengthTypeException if a present field has an unknown length type
     */
    String encode(SortedMap<Integer, String> fields);
}
