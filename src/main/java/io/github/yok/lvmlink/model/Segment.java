package io.github.yok.lvmlink.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One data segment: its header, one {@link ChannelData} per channel and one comment per data row.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Segment {

    private final SegmentHeader header;

    private final List<ChannelData> channels;

    // One entry per data row read, "" when the row had no comment
    private final List<String> comments;

    /**
     * Creates a segment.
     *
     * @param header segment header
     * @param channels per-channel data (copied)
     * @param comments per-row comments (copied)
     */
    public Segment(SegmentHeader header, List<ChannelData> channels, List<String> comments) {
        this.header = header;
        this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
        this.comments = Collections.unmodifiableList(new ArrayList<>(comments));
    }

    /**
     * Returns the number of data rows read for this segment.
     *
     * @return row count
     */
    public int getRowCount() {
        return comments.size();
    }

    /**
     * Returns the X value each channel continues from in the next segment: its last X, or its own
     * X0 when the channel produced no samples.
     *
     * @return one value per channel
     */
    public double[] finalXValues() {
        double[] result = new double[channels.size()];
        for (int ch = 0; ch < channels.size(); ch++) {
            ChannelData data = channels.get(ch);
            result[ch] = data.isEmpty() ? header.getX0(ch) : data.getX(data.size() - 1);
        }
        return result;
    }
}
