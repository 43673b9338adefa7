package io.github.yok.lvmlink.parser;

import io.github.yok.lvmlink.model.ChannelData;
import io.github.yok.lvmlink.model.FileHeader;
import io.github.yok.lvmlink.model.Segment;
import io.github.yok.lvmlink.model.SegmentHeader;
import io.github.yok.lvmlink.model.XColumns;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads the row table that follows a segment header.
 *
 * <p>
 * The reader attempts as many rows as the largest declared {@code Samples} value and stops early
 * at an empty line. Column layout depends on {@code X_Columns}:
 * </p>
 * <ul>
 * <li>{@link XColumns#ONE}: column 0 is the shared X, columns {@code 1..Channels} are Y, the
 * comment follows.</li>
 * <li>{@link XColumns#MULTI}: columns {@code 2i} and {@code 2i+1} are X and Y of channel
 * {@code i}; the comment is at {@code 2*Channels}.</li>
 * <li>{@link XColumns#NO}: X is computed as {@code x0 + Delta_X * row}; Y and comment are laid out
 * as for {@code ONE}.</li>
 * </ul>
 *
 * <p>
 * A blank or unparseable Y value adds nothing to its channel. That is how channels with fewer
 * samples end early inside a shared table. Missing trailing columns read as empty.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SegmentDataReader {

    private static final int INITIAL_CAPACITY = 1024;

    /**
     * Reads one segment's data rows.
     *
     * @param cursor cursor positioned on the first data row
     * @param fileHeader header of the file being read
     * @param header header describing this segment
     * @param x0Override starting X per channel inherited from the previous segment, or
     *        {@code null} to use the header's {@code X0}; channels beyond its length use
     *        {@code X0}
     * @return the segment, or empty if no data remains in the input
     * @throws LvmFormatException if the input ends before the attempted row count is reached
     */
    public Optional<Segment> read(LineCursor cursor, FileHeader fileHeader, SegmentHeader header,
            double[] x0Override) throws LvmFormatException {
        if (cursor.onlyBlankLinesRemain()) {
            return Optional.empty();
        }

        char separator = fileHeader.getSeparator();
        String decimalSeparator = fileHeader.getDecimalSeparator();
        XColumns xColumns = fileHeader.getXColumns();
        int channels = header.getChannels();
        int maxSamples = header.getMaxSamples();
        int commentIndex = xColumns == XColumns.MULTI ? channels * 2 : channels + 1;

        double[] x0 = new double[channels];
        double[] deltaX = new double[channels];
        for (int ch = 0; ch < channels; ch++) {
            // channels added by a fresh header have nothing to inherit
            x0[ch] = x0Override != null && ch < x0Override.length ? x0Override[ch]
                    : header.getX0(ch);
            deltaX[ch] = xColumns == XColumns.NO ? header.getDeltaX(ch) : 0d;
        }

        // Samples is only an upper bound; a blank line may end the table much earlier
        int capacity = Math.min(maxSamples, INITIAL_CAPACITY);
        double[][] xs = new double[channels][capacity];
        double[][] ys = new double[channels][capacity];
        int[] counts = new int[channels];
        List<String> comments = new ArrayList<>();

        if (maxSamples == 0) {
            // an empty table still occupies one line
            cursor.next();
        }

        int row = 0;
        while (row < maxSamples) {
            if (!cursor.hasNext()) {
                throw new LvmFormatException(ErrorKind.TRUNCATED_SEGMENT_DATA,
                        "EOF before finished segment: read " + row + " of " + maxSamples
                                + " rows");
            }
            String line = cursor.next();
            if (line.isEmpty()) {
                break;
            }
            String[] values = StringUtils.splitPreserveAllTokens(line, separator);

            double sharedX = Double.NaN;
            if (xColumns == XColumns.ONE) {
                sharedX = FieldValueParser.parseFloat(column(values, 0), decimalSeparator)
                        .orElse(Double.NaN);
            }

            for (int ch = 0; ch < channels; ch++) {
                double x;
                String rawY;
                if (xColumns == XColumns.MULTI) {
                    x = FieldValueParser.parseFloat(column(values, ch * 2), decimalSeparator)
                            .orElse(Double.NaN);
                    rawY = column(values, ch * 2 + 1);
                } else if (xColumns == XColumns.NO) {
                    x = x0[ch] + deltaX[ch] * row;
                    rawY = column(values, ch + 1);
                } else {
                    x = sharedX;
                    rawY = column(values, ch + 1);
                }

                Optional<Double> y = FieldValueParser.parseFloat(rawY, decimalSeparator);
                if (!y.isPresent()) {
                    // this channel's series has ended
                    continue;
                }
                if (counts[ch] == xs[ch].length) {
                    int grown = grow(xs[ch].length, maxSamples);
                    xs[ch] = Arrays.copyOf(xs[ch], grown);
                    ys[ch] = Arrays.copyOf(ys[ch], grown);
                }
                xs[ch][counts[ch]] = x;
                ys[ch][counts[ch]] = y.get();
                counts[ch]++;
            }

            comments.add(column(values, commentIndex));
            row++;
        }

        if (row == maxSamples && cursor.hasNext() && cursor.peek(0).isEmpty()) {
            // blank line separating this segment from the next
            cursor.next();
        }

        List<ChannelData> data = new ArrayList<>(channels);
        for (int ch = 0; ch < channels; ch++) {
            data.add(new ChannelData(Arrays.copyOf(xs[ch], counts[ch]),
                    Arrays.copyOf(ys[ch], counts[ch])));
        }
        log.debug("Read segment data. xColumns={}, rows={}, samplesPerChannel={}", xColumns, row,
                Arrays.toString(counts));
        return Optional.of(new Segment(header, data, comments));
    }

    private static int grow(int length, int limit) {
        long doubled = Math.max(2L * length, INITIAL_CAPACITY);
        return (int) Math.min(doubled, limit);
    }

    private static String column(String[] values, int index) {
        return index < values.length ? values[index] : "";
    }
}
