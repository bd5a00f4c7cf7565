package com.questrail.iso8583.api;

import java.util.SortedMap;

/**
 * IsoMessage
 * -----------------------------------------------------------------------------
 * Mutable container for the field values of one ISO 8583 transaction message.
 *
 * <h2>Field numbering</h2>
 * <ul>
 *   <li>Field 0 holds the MTI (message type indicator)</li>
 *   <li>Field 1 holds the bitmap hex exactly as read by {@link #parse(String)}.
 *       It is never used by {@link #compose()}, which recomputes the bitmap
 *       from the fields present.</li>
 *   <li>Fields 2-128 hold data elements as text</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * An instance belongs to a single request/response cycle and is not safe for
 * concurrent use.
 */
public interface IsoMessage
{
    /**
     * Replaces all fields with those decoded from {@code raw}. On failure the
     * message is left unchanged.
     *
     * @throws com.questrail.iso8583.codec.IsoCodecException if {@code raw} cannot be parsed
     */
    void parse(String raw);

    /**
     * Encodes the current fields as a message body (no length prefix).
     *
     * @throws com.questrail.iso8583.codec.IsoCodecException if the fields cannot be composed
     */
    String compose();

    /**
     * Returns the value of {@code field}, or the empty string if absent.
     */
    String getField(int field);

    /**
     * Stores the text form of {@code value} under {@code field}.
     *
     * @throws IllegalArgumentException if {@code field} is outside 0-128
     */
    void setField(int field, Object value);

    boolean hasField(int field);

    /**
     * Removes {@code field} if present.
     */
    void unsetField(int field);

    String getMti();

    void setMti(String mti);

    /**
     * Drops every field so the instance can be reused.
     */
    void clear();

    /**
     * Unmodifiable snapshot of all fields in ascending field order.
     */
    SortedMap<Integer, String> fields();

    /**
     * Renders one {@code [NNN][value]} line per field in ascending field
     * order, each terminated by a newline.
     */
    String prettyPrint();
}
