package io.github.yok.lvmlink.parser;

import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Discards the lines of a special block.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class SpecialBlockSkipper {

    @Generated
    private SpecialBlockSkipper() {
        throw new AssertionError(
                "No io.github.yok.lvmlink.parser.SpecialBlockSkipper instances for you!");
    }

    /**
     * Consumes lines up to and including the next line starting with
     * {@link LvmFormat#SPECIAL_BLOCK_END}, or to the end of input if there is none. The cursor is
     * expected to sit just after the start marker.
     *
     * @param cursor line cursor
     * @return number of lines consumed, end marker included
     */
    public static int skip(LineCursor cursor) {
        int skipped = 0;
        while (cursor.hasNext()) {
            String line = cursor.next();
            skipped++;
            if (line.startsWith(LvmFormat.SPECIAL_BLOCK_END)) {
                log.debug("Skipped special block. lines={}", skipped);
                return skipped;
            }
        }
        log.debug("Special block ran to end of input. lines={}", skipped);
        return skipped;
    }
}
