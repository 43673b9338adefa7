package io.github.yok.lvmlink.model;

import io.github.yok.lvmlink.parser.HeaderSchema;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Validated, immutable file header of an LVM file.
 *
 * <p>
 * Values are keyed by the header field names of {@link HeaderSchema#FILE_HEADERS}. The
 * {@code Separator} entry holds the one-character delimiter string, not the textual declaration
 * (e.g. {@code "\t"} rather than {@code "Tab"}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
@EqualsAndHashCode
public final class FileHeader {

    private final Map<String, Object> values;

    /**
     * Creates a header from already validated values.
     *
     * @param values field values (copied)
     * @throws IllegalArgumentException if the separator entry is not exactly one character
     */
    public FileHeader(Map<String, Object> values) {
        Object sep = values.get(HeaderSchema.SEPARATOR);
        if (!(sep instanceof String) || ((String) sep).length() != 1) {
            throw new IllegalArgumentException("Separator must be a single character: " + sep);
        }
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns all header values in declaration order.
     *
     * @return unmodifiable map of field name to value
     */
    public Map<String, Object> getValues() {
        return values;
    }

    /**
     * Returns the value of a field.
     *
     * @param field header field name
     * @return the value, or {@code null} if absent
     */
    public Object get(String field) {
        return values.get(field);
    }

    public char getSeparator() {
        return ((String) values.get(HeaderSchema.SEPARATOR)).charAt(0);
    }

    public String getDecimalSeparator() {
        return (String) values.get(HeaderSchema.DECIMAL_SEPARATOR);
    }

    public boolean isMultiHeadings() {
        return Boolean.TRUE.equals(values.get(HeaderSchema.MULTI_HEADINGS));
    }

    public XColumns getXColumns() {
        return XColumns.fromLabel((String) values.get(HeaderSchema.X_COLUMNS));
    }

    public LocalDate getDate() {
        return (LocalDate) values.get(HeaderSchema.DATE);
    }

    public LocalTime getTime() {
        return (LocalTime) values.get(HeaderSchema.TIME);
    }

    public double getWriterVersion() {
        return (Double) values.get(HeaderSchema.WRITER_VERSION);
    }

    public double getReaderVersion() {
        return (Double) values.get(HeaderSchema.READER_VERSION);
    }
}
