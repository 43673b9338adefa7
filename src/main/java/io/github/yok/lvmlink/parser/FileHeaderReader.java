package io.github.yok.lvmlink.parser;

import io.github.yok.lvmlink.model.FileHeader;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads the leading key/value block of an LVM file into a {@link FileHeader}.
 *
 * <p>
 * Reading happens in two passes over the same lines:
 * </p>
 * <ol>
 * <li>A pre-scan peeks ahead for the {@code Separator} declaration without consuming anything,
 * because every other header line must be split with the delimiter it declares.</li>
 * <li>The header block is then parsed line by line up to and including
 * {@link LvmFormat#END_OF_HEADER}.</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FileHeaderReader {

    /**
     * Reads and validates the file header. On return the cursor sits on the line after the
     * end-of-header marker.
     *
     * @param cursor cursor positioned at the first line of the file
     * @return the validated file header
     * @throws LvmFormatException if the header is malformed
     */
    public FileHeader read(LineCursor cursor) throws LvmFormatException {
        char separator = findSeparator(cursor);
        String sep = String.valueOf(separator);

        Map<String, Object> header = HeaderSchema.defaults(HeaderSchema.FILE_HEADERS);

        String identifier = cursor.hasNext() ? cursor.next() : "";
        if (!identifier.startsWith(LvmFormat.FILE_MAGIC_IDENTIFIER)) {
            throw new LvmFormatException(ErrorKind.MAGIC_MISMATCH, "Did not find magic identifier "
                    + LvmFormat.FILE_MAGIC_IDENTIFIER + " at start of file", null, identifier);
        }

        while (cursor.hasNext()) {
            String line = cursor.next();

            if (line.startsWith(LvmFormat.END_OF_HEADER)) {
                HeaderValidator.validate(header, HeaderSchema.FILE_HEADERS);
                header.put(HeaderSchema.SEPARATOR, sep);
                header.putIfAbsent(HeaderSchema.READER_VERSION,
                        header.get(HeaderSchema.WRITER_VERSION));
                FileHeader fileHeader = new FileHeader(header);
                log.debug("Read file header. separator={}, decimalSeparator={}, xColumns={}, "
                        + "multiHeadings={}", StringUtils.replace(sep, "\t", "\\t"),
                        fileHeader.getDecimalSeparator(), fileHeader.getXColumns(),
                        fileHeader.isMultiHeadings());
                return fileHeader;
            }
            if (line.isEmpty() || line.startsWith(sep)) {
                continue;
            }
            if (line.startsWith(LvmFormat.SPECIAL_BLOCK_START)) {
                SpecialBlockSkipper.skip(cursor);
                continue;
            }

            String[] tokens = StringUtils.splitPreserveAllTokens(line, separator);
            if (tokens.length != 2) {
                throw new LvmFormatException(ErrorKind.FIELD_COERCION_FAILURE,
                        "Error parsing key,value pair from '" + line + "'", tokens[0], line);
            }
            String key = tokens[0];
            String raw = tokens[1];
            FieldSpec spec = HeaderSchema.FILE_HEADERS.get(key);
            if (spec == null) {
                throw new LvmFormatException(ErrorKind.UNKNOWN_FIELD,
                        "Invalid File Header: " + key, key, raw);
            }

            Optional<Object> value = parseField(key, raw, spec.getType(), separator,
                    (String) header.get(HeaderSchema.DECIMAL_SEPARATOR));
            if (!value.isPresent()) {
                throw new LvmFormatException(ErrorKind.FIELD_COERCION_FAILURE,
                        "Error parsing value of " + key + " at: " + line, key, raw);
            }
            header.put(key, value.get());
        }

        throw new LvmFormatException(ErrorKind.TRUNCATED_FILE_HEADER,
                "Failed to parse file header: " + LvmFormat.END_OF_HEADER + " not found");
    }

    /**
     * Looks ahead for the delimiter declaration without moving the cursor.
     *
     * @param cursor line cursor
     * @return the character right after the {@code Separator} keyword, or a tab if the header
     *         ends without a declaration
     * @throws LvmFormatException if the input ends before either is found
     */
    char findSeparator(LineCursor cursor) throws LvmFormatException {
        for (int offset = 0;; offset++) {
            String line = cursor.peek(offset);
            if (line == null) {
                break;
            }
            if (line.startsWith(LvmFormat.SEPARATOR_KEY)
                    && line.length() > LvmFormat.SEPARATOR_KEY.length()) {
                return line.charAt(LvmFormat.SEPARATOR_KEY.length());
            }
            if (line.startsWith(LvmFormat.END_OF_HEADER)) {
                log.debug("No Separator header found; assuming tab");
                return LvmFormat.DEFAULT_SEPARATOR;
            }
        }
        throw new LvmFormatException(ErrorKind.MISSING_DELIMITER_DECLARATION,
                "Separator header not found");
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
