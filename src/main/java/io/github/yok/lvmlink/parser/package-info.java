/**
 * LVM parsing engine.
 *
 * <p>
 * {@code LvmParser} drives {@code FileHeaderReader} once and then {@code SegmentReader} until the
 * input is exhausted. {@code SegmentReader} decides per segment whether a fresh header is read by
 * {@code SegmentHeaderReader} before {@code SegmentDataReader} consumes the row table.
 * </p>
 *
 * <p>
 * Field decoding lives in {@code FieldValueParser}; the header field tables live in
 * {@code HeaderSchema}. Every structural problem is reported as {@code LvmFormatException}.
 * </p>
 */
package io.github.yok.lvmlink.parser;
