package io.github.yok.lvmlink.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Complete result of parsing one LVM file.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ParseResult {

    private final FileHeader fileHeader;

    // Segments in file order
    private final List<Segment> segments;

    /**
     * Creates a result.
     *
     * @param fileHeader file header
     * @param segments segments in encounter order (copied)
     */
    public ParseResult(FileHeader fileHeader, List<Segment> segments) {
        this.fileHeader = fileHeader;
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }
}
