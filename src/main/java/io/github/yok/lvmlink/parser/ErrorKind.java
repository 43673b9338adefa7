package io.github.yok.lvmlink.parser;

/**
 * Classification of the structural problems that abort an LVM parse.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ErrorKind {

    // First line does not carry the "LabVIEW Measurement" identifier.
    MAGIC_MISMATCH,

    // No Separator line and no end-of-header marker before the input ran out.
    MISSING_DELIMITER_DECLARATION,

    // Header key that the applicable schema does not know.
    UNKNOWN_FIELD,

    // Required schema field never received a value.
    MISSING_REQUIRED_FIELD,

    // Enumerated field holds a value outside its option set.
    INVALID_OPTION,

    // Declared-type value could not be decoded.
    FIELD_COERCION_FAILURE,

    // Multi-valued field count is neither 1 nor Channels.
    CHANNEL_CARDINALITY_MISMATCH,

    // File header never reached its end-of-header marker.
    TRUNCATED_FILE_HEADER,

    // Segment header started but never reached its end-of-header marker.
    TRUNCATED_SEGMENT_HEADER,

    // Fewer data rows than the maximum declared sample count.
    TRUNCATED_SEGMENT_DATA,

    // Column-name row missing or not starting with X_Value.
    MALFORMED_COLUMN_ROW
}
