/**
 * In-memory model of a parsed LVM file.
 *
 * <p>
 * A {@link io.github.yok.lvmlink.model.ParseResult} owns one
 * {@link io.github.yok.lvmlink.model.FileHeader} and the ordered
 * {@link io.github.yok.lvmlink.model.Segment}s. All types are immutable once constructed.
 * </p>
 */
package io.github.yok.lvmlink.model;
