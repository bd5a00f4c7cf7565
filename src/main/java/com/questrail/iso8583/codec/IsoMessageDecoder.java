package com.questrail.iso8583.codec;

import java.util.SortedMap;

/**
 * IsoMessageDecoder
 * -----------------------------------------------------------------------------
 * Text-level decoder for ISO 8583 message bodies.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Reading the MTI and bitmap</li>
 *   <li>Walking present fields in ascending order according to the schema</li>
 *   <li>Detecting truncated or malformed input</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for framing, routing,
 * or interpreting field values.</p>
 */
public interface IsoMessageDecoder
{
    /**
     * Parse one complete message body (without its length prefix).
     *
     * @param raw message body
     * @return field number to value, including field 0 (MTI) and field 1
     *         (bitmap hex exactly as read)
     * @throws IsoDecodeException if the input is malformed or truncated
     * @throws MissingFieldConfigException if the bitmap names a field with no rule
     * @throws UnsupportedLengthTypeException if a present field has an unknown length type
     */
    SortedMap<Integer, String> decode(String raw);
}
