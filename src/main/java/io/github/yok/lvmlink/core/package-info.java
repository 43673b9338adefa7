/**
 * Core read/export workflow of LvmLink.
 *
 * <p>
 * {@code LvmReader} decodes files and delegates to the parser, consulting
 * {@code ParseResultCache}; {@code SegmentCsvExporter} writes parsed segments as CSV.
 * </p>
 */
package io.github.yok.lvmlink.core;
