package io.github.yok.lvmlink.parser;

import lombok.Generated;

/**
 * Fixed tokens of the LabVIEW Measurement file format.
 *
 * @author Yasuharu.Okawauchi
 */
public final class LvmFormat {

    /** Identifier at column 0, row 0 of every LVM file. */
    public static final String FILE_MAGIC_IDENTIFIER = "LabVIEW Measurement";

    /** Terminates the file header and every segment header. */
    public static final String END_OF_HEADER = "***End_of_Header***";

    /** Opens a block of opaque lines skipped during header parsing. */
    public static final String SPECIAL_BLOCK_START = "***Start_Special***";

    /** Closes a special block. */
    public static final String SPECIAL_BLOCK_END = "***End_Special***";

    /** Keyword whose next character declares the delimiter. */
    public static final String SEPARATOR_KEY = "Separator";

    /** First token of the column-name row. */
    public static final String X_VALUE_COLUMN = "X_Value";

    /** Trailing per-row comment column. */
    public static final String COMMENT_COLUMN = "Comment";

    /** Delimiter assumed when the header declares none. */
    public static final char DEFAULT_SEPARATOR = '\t';

    @Generated
    private LvmFormat() {
        throw new AssertionError("No io.github.yok.lvmlink.parser.LvmFormat instances for you!");
    }
}
