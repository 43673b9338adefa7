package io.github.yok.lvmlink.parser;

import io.github.yok.lvmlink.model.FileHeader;
import io.github.yok.lvmlink.model.SegmentHeader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads one segment header and its column-name row.
 *
 * <p>
 * Header lines carry a key followed by one value per channel, or a single value shared by all
 * channels. {@code Channels} must therefore appear before any field whose per-channel count is
 * checked against it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SegmentHeaderReader {

    /**
     * Reads the next segment header.
     *
     * @param cursor cursor positioned after the previous segment's data, or after the file header
     * @param fileHeader header of the file being read
     * @return the header, or empty if the input ended before any header content
     * @throws LvmFormatException if the header is malformed or truncated
     */
    public Optional<SegmentHeader> read(LineCursor cursor, FileHeader fileHeader)
            throws LvmFormatException {
        char separator = fileHeader.getSeparator();
        String sep = String.valueOf(separator);
        String decimalSeparator = fileHeader.getDecimalSeparator();

        Map<String, Object> header = HeaderSchema.defaults(HeaderSchema.SEGMENT_HEADERS);
        boolean started = false;

        while (cursor.hasNext()) {
            String line = cursor.next();

            if (line.startsWith(LvmFormat.END_OF_HEADER)) {
                HeaderValidator.validate(header, HeaderSchema.SEGMENT_HEADERS);
                Object channels = header.get(HeaderSchema.CHANNELS);
                if (!(channels instanceof Integer) || (Integer) channels < 1) {
                    throw new LvmFormatException(ErrorKind.FIELD_COERCION_FAILURE,
                            "Channels must be a single integer >= 1: " + channels,
                            HeaderSchema.CHANNELS, String.valueOf(channels));
                }
                return Optional.of(readColumns(cursor, header, separator));
            }
            if (line.isEmpty() || line.startsWith(sep)) {
                continue;
            }
            if (line.startsWith(LvmFormat.SPECIAL_BLOCK_START)) {
                SpecialBlockSkipper.skip(cursor);
                continue;
            }

            started = true;
            String[] tokens = StringUtils.splitPreserveAllTokens(line, separator);
            String key = tokens[0];
            FieldSpec spec = HeaderSchema.SEGMENT_HEADERS.get(key);
            if (spec == null) {
                throw new LvmFormatException(ErrorKind.UNKNOWN_FIELD,
                        "Invalid Segment Header: " + key, key, line);
            }

            List<Object> data = new ArrayList<>();
            for (int i = 1; i < tokens.length; i++) {
                if (tokens[i].isEmpty()) {
                    continue;
                }
                parseField(key, tokens[i], spec.getType(), separator, decimalSeparator)
                        .ifPresent(data::add);
            }

            Object channels = header.get(HeaderSchema.CHANNELS);
            if (data.isEmpty()) {
                throw new LvmFormatException(ErrorKind.FIELD_COERCION_FAILURE,
                        "Error parsing value of " + key + " at: " + line, key, line);
            } else if (data.size() == 1) {
                header.put(key, data.get(0));
            } else if (channels != null && data.size() == (Integer) channels) {
                header.put(key, data);
            } else {
                throw new LvmFormatException(ErrorKind.CHANNEL_CARDINALITY_MISMATCH,
                        "Mismatch between number of Channels ("
                                + (channels != null ? channels : "Not Found") + ") and header "
                                + key + " data " + data + " (" + data.size() + ")",
                        key, line);
            }
        }

        if (!started) {
            return Optional.empty();
        }
        throw new LvmFormatException(ErrorKind.TRUNCATED_SEGMENT_HEADER,
                "Failed to parse segment header: " + LvmFormat.END_OF_HEADER + " not found");
    }

    private SegmentHeader readColumns(LineCursor cursor, Map<String, Object> header,
            char separator) throws LvmFormatException {
        String columnNames = cursor.hasNext() ? cursor.next() : null;
        if (columnNames == null || !columnNames.startsWith(LvmFormat.X_VALUE_COLUMN)) {
            throw new LvmFormatException(ErrorKind.MALFORMED_COLUMN_ROW,
                    "Failed to read column names", null, columnNames);
        }
        List<String> columns =
                Arrays.asList(StringUtils.splitPreserveAllTokens(columnNames, separator));
        List<String> yLabels = new ArrayList<>();
        for (String column : columns) {
            if (!LvmFormat.X_VALUE_COLUMN.equals(column)
                    && !LvmFormat.COMMENT_COLUMN.equals(column)) {
                yLabels.add(column);
            }
        }
        SegmentHeader segmentHeader = new SegmentHeader(header, columns, yLabels);
        log.debug("Read segment header. channels={}, maxSamples={}, yLabels={}",
                segmentHeader.getChannels(), segmentHeader.getMaxSamples(), yLabels);
        return segmentHeader;
    }

    private static Optional<Object> parseField(String key, String raw, FieldType type,
            char separator, String decimalSeparator) throws LvmFormatException {
        try {
            return FieldValueParser.parse(raw, type, separator, decimalSeparator);
        } catch (LvmFormatException e) {
            throw new LvmFormatException(e.getKind(),
                    "Error parsing value of " + key + ": " + e.getMessage(), key, raw, e);
        }
    }
}
