package io.github.yok.lvmlink.model;

import io.github.yok.lvmlink.parser.HeaderSchema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Validated, immutable header of one data segment.
 *
 * <p>
 * A value is either a scalar that applies to every channel or a {@link List} with exactly
 * {@link #getChannels()} elements, one per channel. Use {@link #perChannel(String, int)} to read a
 * field without caring which form the file used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
@EqualsAndHashCode
public final class SegmentHeader {

    private final Map<String, Object> values;

    // Column-name row, split on the delimiter
    private final List<String> columns;

    // Columns minus X_Value and Comment
    private final List<String> yLabels;

    /**
     * Creates a header.
     *
     * @param values field values; list values are copied
     * @param columns column-name row tokens
     * @param yLabels Y column labels
     */
    public SegmentHeader(Map<String, Object> values, List<String> columns, List<String> yLabels) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> copy.put(k,
                v instanceof List ? Collections.unmodifiableList(new ArrayList<>((List<?>) v)) : v));
        this.values = Collections.unmodifiableMap(copy);
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.yLabels = Collections.unmodifiableList(new ArrayList<>(yLabels));
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<String> getYLabels() {
        return yLabels;
    }

    /**
     * Returns the raw value of a field: a scalar or a per-channel list.
     *
     * @param field header field name
     * @return the value, or {@code null} if absent
     */
    public Object get(String field) {
        return values.get(field);
    }

    /**
     * Returns whether the field was given one value per channel.
     *
     * @param field header field name
     * @return {@code true} if the value is a per-channel list
     */
    public boolean isPerChannel(String field) {
        return values.get(field) instanceof List;
    }

    /**
     * Returns a field's value for one channel.
     *
     * @param field header field name
     * @param channel zero-based channel index
     * @return the channel's value; the scalar when the field has a single value
     */
    public Object perChannel(String field, int channel) {
        Object value = values.get(field);
        if (value instanceof List) {
            return ((List<?>) value).get(channel);
        }
        return value;
    }

    public int getChannels() {
        return (Integer) values.get(HeaderSchema.CHANNELS);
    }

    /**
     * Returns the declared sample count of a channel.
     *
     * @param channel zero-based channel index
     * @return declared sample count
     */
    public int getSamples(int channel) {
        return (Integer) perChannel(HeaderSchema.SAMPLES, channel);
    }

    /**
     * Returns the largest declared sample count across channels; this is the number of data rows
     * a segment reader attempts.
     *
     * @return maximum sample count
     */
    public int getMaxSamples() {
        int max = 0;
        for (int ch = 0; ch < getChannels(); ch++) {
            max = Math.max(max, getSamples(ch));
        }
        return max;
    }

    /**
     * Returns the initial X value of a channel.
     *
     * @param channel zero-based channel index
     * @return X0 as a double
     */
    public double getX0(int channel) {
        return ((Number) perChannel(HeaderSchema.X0, channel)).doubleValue();
    }

    /**
     * Returns the X increment of a channel.
     *
     * @param channel zero-based channel index
     * @return Delta_X as a double
     */
    public double getDeltaX(int channel) {
        return ((Number) perChannel(HeaderSchema.DELTA_X, channel)).doubleValue();
    }
}
