package io.github.yok.lvmlink.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Generated;

/**
 * Declarative tables of the file-header and segment-header fields.
 *
 * <p>
 * Both tables are immutable and iterate in declaration order. They are checked for internal
 * consistency when this class is initialized: every default value must be an instance of its
 * declared type, and every option default must be one of its options.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class HeaderSchema {

    public static final String DATE = "Date";
    public static final String TIME = "Time";
    public static final String DESCRIPTION = "Description";
    public static final String MULTI_HEADINGS = "Multi_Headings";
    public static final String OPERATOR = "Operator";
    public static final String PROJECT = "Project";
    public static final String READER_VERSION = "Reader_Version";
    public static final String WRITER_VERSION = "Writer_Version";
    public static final String SEPARATOR = "Separator";
    public static final String DECIMAL_SEPARATOR = "Decimal_Separator";
    public static final String TIME_PREF = "Time_Pref";
    public static final String X_COLUMNS = "X_Columns";

    public static final String CHANNELS = "Channels";
    public static final String DELTA_X = "Delta_X";
    public static final String NOTES = "Notes";
    public static final String SAMPLES = "Samples";
    public static final String TEST_NAME = "Test_Name";
    public static final String TEST_NUMBERS = "Test_Numbers";
    public static final String TEST_SERIES = "Test_Series";
    public static final String UUT_MODEL_NUMBER = "UUT_M/N";
    public static final String UUT_NAME = "UUT_Name";
    public static final String UUT_SERIAL_NUMBER = "UUT_S/N";
    public static final String X0 = "X0";
    public static final String X_DIMENSION = "X_Dimension";
    public static final String X_UNIT_LABEL = "X_Unit_Label";
    public static final String Y_DIMENSION = "Y_Dimension";
    public static final String Y_UNIT_LABEL = "Y_Unit_Label";

    /** Fields allowed before the first end-of-header marker. */
    public static final Map<String, FieldSpec> FILE_HEADERS;

    /** Fields allowed in a segment header. */
    public static final Map<String, FieldSpec> SEGMENT_HEADERS;

    static {
        Map<String, FieldSpec> file = new LinkedHashMap<>();
        file.put(DATE, FieldSpec.required(FieldType.DATE));
        file.put(DESCRIPTION, FieldSpec.optional(FieldType.TEXT, ""));
        file.put(MULTI_HEADINGS, FieldSpec.optional(FieldType.BOOL, Boolean.FALSE));
        file.put(OPERATOR, FieldSpec.optional(FieldType.TEXT, ""));
        file.put(PROJECT, FieldSpec.optional(FieldType.TEXT, ""));
        // Falls back to Writer_Version once the header is complete
        file.put(READER_VERSION, FieldSpec.optional(FieldType.FLOAT, null));
        file.put(SEPARATOR, FieldSpec.optional(FieldType.TEXT,
                String.valueOf(LvmFormat.DEFAULT_SEPARATOR)));
        file.put(DECIMAL_SEPARATOR, FieldSpec.optional(FieldType.TEXT, ","));
        file.put(TIME, FieldSpec.required(FieldType.TIME));
        file.put(TIME_PREF, FieldSpec.options("Relative", "Absolute", "Relative"));
        file.put(WRITER_VERSION, FieldSpec.required(FieldType.FLOAT));
        file.put(X_COLUMNS, FieldSpec.options("One", "No", "One", "Multi"));
        FILE_HEADERS = Collections.unmodifiableMap(verify(file));

        Map<String, FieldSpec> segment = new LinkedHashMap<>();
        segment.put(CHANNELS, FieldSpec.required(FieldType.INTEGER));
        segment.put(DATE, FieldSpec.required(FieldType.DATE));
        segment.put(DELTA_X, FieldSpec.required(FieldType.NUMBER));
        segment.put(NOTES, FieldSpec.optional(FieldType.TEXT, ""));
        segment.put(SAMPLES, FieldSpec.required(FieldType.INTEGER));
        segment.put(TEST_NAME, FieldSpec.optional(FieldType.TEXT, ""));
        segment.put(TEST_NUMBERS, FieldSpec.optional(FieldType.TEXT, ""));
        segment.put(TEST_SERIES, FieldSpec.optional(FieldType.TEXT, ""));
        segment.put(TIME, FieldSpec.required(FieldType.TIME));
        segment.put(UUT_MODEL_NUMBER, FieldSpec.optional(FieldType.TEXT, ""));
        segment.put(UUT_NAME, FieldSpec.optional(FieldType.TEXT, ""));
        segment.put(UUT_SERIAL_NUMBER, FieldSpec.optional(FieldType.TEXT, ""));
        segment.put(X0, FieldSpec.required(FieldType.NUMBER));
        segment.put(X_DIMENSION, FieldSpec.optional(FieldType.TEXT, "Time"));
        segment.put(X_UNIT_LABEL, FieldSpec.optional(FieldType.TEXT, "Default SI Unit"));
        segment.put(Y_DIMENSION, FieldSpec.optional(FieldType.TEXT, "Electric Potential"));
        segment.put(Y_UNIT_LABEL, FieldSpec.optional(FieldType.TEXT, "Default SI Unit"));
        SEGMENT_HEADERS = Collections.unmodifiableMap(verify(segment));
    }

    @Generated
    private HeaderSchema() {
        throw new AssertionError(
                "No io.github.yok.lvmlink.parser.HeaderSchema instances for you!");
    }

    /**
     * Returns a fresh mutable map holding the default of every optional field that declares one.
     *
     * @param schema schema to read defaults from
     * @return map of field name to default value, in schema order
     */
    public static Map<String, Object> defaults(Map<String, FieldSpec> schema) {
        Map<String, Object> values = new LinkedHashMap<>();
        schema.forEach((name, spec) -> {
            if (!spec.isRequired() && spec.hasDefault()) {
                values.put(name, spec.getDefaultValue());
            }
        });
        return values;
    }

    /**
     * Checks a schema table for internal consistency.
     *
     * @param schema table to check
     * @return the same table
     * @throws IllegalStateException if a default does not match its declared type, an option
     *         default is not among its options, or a required field declares a default
     */
    static Map<String, FieldSpec> verify(Map<String, FieldSpec> schema) {
        schema.forEach((name, spec) -> {
            if (spec.isRequired() && spec.hasDefault()) {
                throw new IllegalStateException("Required field " + name + " declares a default");
            }
            if (spec.hasDefault() && !spec.getType().accepts(spec.getDefaultValue())) {
                throw new IllegalStateException("Default of field " + name + " ("
                        + spec.getDefaultValue() + ") is not of type " + spec.getType());
            }
            if (spec.getType() == FieldType.OPTIONS && spec.hasDefault()
                    && !spec.getOptions().contains(spec.getDefaultValue())) {
                throw new IllegalStateException("Default of field " + name + " ("
                        + spec.getDefaultValue() + ") is not one of " + spec.getOptions());
            }
        });
        return schema;
    }
}
