package io.github.yok.lvmlink.parser;

import io.github.yok.lvmlink.model.FileHeader;
import io.github.yok.lvmlink.model.ParseResult;
import io.github.yok.lvmlink.model.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Parses a complete LVM file: the file header once, then segments until the input runs out.
 *
 * <p>
 * Instances hold no per-parse state and may be shared.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class LvmParser {

    private final FileHeaderReader fileHeaderReader;
    private final SegmentReader segmentReader;

    /**
     * Creates a parser with the default readers.
     */
    public LvmParser() {
        this(new FileHeaderReader(), new SegmentReader());
    }

    /**
     * Parses in-memory LVM content.
     *
     * @param content file content
     * @return the parse result
     * @throws LvmFormatException if the content is malformed
     */
    public ParseResult parse(String content) throws LvmFormatException {
        return parse(LineCursor.fromText(content));
    }

    /**
     * Parses a list of file lines.
     *
     * @param lines file lines, with or without terminators
     * @return the parse result
     * @throws LvmFormatException if the lines are malformed
     */
    public ParseResult parse(List<String> lines) throws LvmFormatException {
        return parse(new LineCursor(lines));
    }

    /**
     * Parses everything remaining in the cursor.
     *
     * @param cursor cursor positioned at the first line of the file
     * @return the parse result
     * @throws LvmFormatException if the input is malformed
     */
    public ParseResult parse(LineCursor cursor) throws LvmFormatException {
        FileHeader fileHeader = fileHeaderReader.read(cursor);

        List<Segment> segments = new ArrayList<>();
        Segment previous = null;
        while (true) {
            Optional<Segment> segment = segmentReader.read(cursor, fileHeader, previous);
            if (!segment.isPresent()) {
                break;
            }
            previous = segment.get();
            segments.add(previous);
        }

        log.debug("Parsed LVM content. segments={}, lines={}", segments.size(),
                cursor.position());
        return new ParseResult(fileHeader, segments);
    }
}
