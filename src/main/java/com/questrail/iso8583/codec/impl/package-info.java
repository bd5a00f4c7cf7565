/**
 * ISO 8583 Codec Implementation
 * =============================================================================
 *
 * <p>Concrete text codec for ISO 8583 message bodies.</p>
 *
 * <pre>
 *   String body
 *        → DefaultIsoMessageDecoder   (MTI, Bitmap.fromHex, field walk)
 *            → SortedMap&lt;Integer, String&gt;
 *                → DefaultIsoMessageEncoder  (Bitmap.forFields, FieldPadding)
 *                    → String body
 * </pre>
 *
 * <p>This layer is strictly schema-driven and transport-agnostic. Framing
 * (the 4-digit length prefix) lives in the transport package.</p>
 */
package com.questrail.iso8583.codec.impl;
