package com.questrail.iso8583.codec.impl;

/**
 * Fits a value to a fixed-width field.
 *
 * <p>Shorter values are padded: numeric content on the left with {@code '0'},
 * everything else on the right with spaces. Longer values are truncated to
 * their first {@code width} characters regardless of content type, so a
 * numeric value keeps its leading digits.</p>
 */
final class FieldPadding
{
    private FieldPadding() {}

    static String fit(String value, int width, boolean numeric)
    {
        if (value.length() >= width) {
            return value.substring(0, width);
        }
        final StringBuilder sb = new StringBuilder(width);
        if (numeric) {
            sb.append("0".repeat(width - value.length())).append(value);
        } else {
            sb.append(value).append(" ".repeat(width - value.length()));
        }
        return sb.toString();
    }

    /**
     * Renders a variable-length prefix, zero-padded to {@code digits}.
     */
    static String lengthPrefix(int length, int digits)
    {
        final String s = Integer.toString(length);
        return "0".repeat(Math.max(0, digits - s.length())) + s;
    }
}
