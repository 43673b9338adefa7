/**
 * Root package of LvmLink.
 *
 * <p>
 * Provides a CLI/library that reads LabVIEW Measurement ({@code .lvm}) files into an in-memory
 * model, caches parse results and exports segments to CSV.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.lvmlink.parser}: the parsing engine</li>
 * <li>{@code io.github.yok.lvmlink.model}: parsed file headers, segments and channel data</li>
 * <li>{@code io.github.yok.lvmlink.core}: file reading, caching and CSV export</li>
 * <li>{@code io.github.yok.lvmlink.config}: configuration models</li>
 * </ul>
 */
package io.github.yok.lvmlink;
