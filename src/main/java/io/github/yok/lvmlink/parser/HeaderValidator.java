package io.github.yok.lvmlink.parser;

import java.util.Map;
import lombok.Generated;

/**
 * Checks a populated header mapping against its schema.
 *
 * @author Yasuharu.Okawauchi
 */
public final class HeaderValidator {

    @Generated
    private HeaderValidator() {
        throw new AssertionError(
                "No io.github.yok.lvmlink.parser.HeaderValidator instances for you!");
    }

    /**
     * Validates required fields and option values, in schema order.
     *
     * <p>
     * An {@link FieldType#OPTIONS} value stored as a per-channel list is checked element by
     * element.
     * </p>
     *
     * @param header header values keyed by field name
     * @param schema schema the header was built from
     * @throws LvmFormatException with {@link ErrorKind#MISSING_REQUIRED_FIELD} or
     *         {@link ErrorKind#INVALID_OPTION} on the first violation
     */
    public static void validate(Map<String, Object> header, Map<String, FieldSpec> schema)
            throws LvmFormatException {
        for (Map.Entry<String, FieldSpec> entry : schema.entrySet()) {
            String name = entry.getKey();
            FieldSpec spec = entry.getValue();
            Object value = header.get(name);
            if (spec.isRequired() && value == null) {
                throw new LvmFormatException(ErrorKind.MISSING_REQUIRED_FIELD,
                        "Header " + name + " not found", name, null);
            }
            if (spec.getType() == FieldType.OPTIONS && value != null) {
                checkOption(name, spec, value);
            }
        }
    }

    private static void checkOption(String name, FieldSpec spec, Object value)
            throws LvmFormatException {
        if (value instanceof Iterable) {
            for (Object element : (Iterable<?>) value) {
                checkOption(name, spec, element);
            }
            return;
        }
        if (!spec.getOptions().contains(value)) {
            throw new LvmFormatException(ErrorKind.INVALID_OPTION,
                    "Header " + name + " has no option " + value, name, String.valueOf(value));
        }
    }
}
