package io.github.yok.lvmlink.parser;

import io.github.yok.lvmlink.model.FileHeader;
import io.github.yok.lvmlink.model.Segment;
import io.github.yok.lvmlink.model.SegmentHeader;
import java.util.Optional;
import lombok.RequiredArgsConstructor;

/**
 * Reads one segment, deciding whether it carries its own header.
 *
 * <p>
 * A header is read when none is held yet or when the file declares {@code Multi_Headings=Yes};
 * otherwise the previous header is reused. From the second segment on, the X axis continues from
 * the previous segment's final X values, whichever header is in effect.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@RequiredArgsConstructor
public class SegmentReader {

    private final SegmentHeaderReader headerReader;
    private final SegmentDataReader dataReader;

    /**
     * Creates a reader with the default header and data readers.
     */
    public SegmentReader() {
        this(new SegmentHeaderReader(), new SegmentDataReader());
    }

    /**
     * Reads the next segment.
     *
     * @param cursor line cursor
     * @param fileHeader header of the file being read
     * @param previous the previous segment, or {@code null} for the first one
     * @return the segment, or empty when the file has no further segments
     * @throws LvmFormatException if the segment is malformed
     */
    public Optional<Segment> read(LineCursor cursor, FileHeader fileHeader, Segment previous)
            throws LvmFormatException {
        SegmentHeader header = previous != null ? previous.getHeader() : null;

        if (header == null || fileHeader.isMultiHeadings()) {
            Optional<SegmentHeader> next = headerReader.read(cursor, fileHeader);
            if (!next.isPresent()) {
                return Optional.empty();
            }
            header = next.get();
        }

        double[] x0Override = previous != null ? previous.finalXValues() : null;
        return dataReader.read(cursor, fileHeader, header, x0Override);
    }
}
