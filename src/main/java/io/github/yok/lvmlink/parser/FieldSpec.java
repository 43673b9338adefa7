package io.github.yok.lvmlink.parser;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable descriptor of one header field: whether it is required, its default value, its
 * declared type and, for {@link FieldType#OPTIONS} fields, the permitted values.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class FieldSpec {

    private final boolean required;

    // Default value for optional fields; null when the field has none
    private final Object defaultValue;

    private final FieldType type;

    // Permitted values, empty unless type is OPTIONS
    private final Set<String> options;

    private FieldSpec(boolean required, Object defaultValue, FieldType type, Set<String> options) {
        this.required = required;
        this.defaultValue = defaultValue;
        this.type = type;
        this.options = options;
    }

    /**
     * Creates a descriptor for a required field.
     *
     * @param type declared type
     * @return the descriptor
     */
    public static FieldSpec required(FieldType type) {
        return new FieldSpec(true, null, type, Collections.emptySet());
    }

    /**
     * Creates a descriptor for an optional field.
     *
     * @param type declared type
     * @param defaultValue value used when the file omits the field (may be {@code null})
     * @return the descriptor
     */
    public static FieldSpec optional(FieldType type, Object defaultValue) {
        return new FieldSpec(false, defaultValue, type, Collections.emptySet());
    }

    /**
     * Creates a descriptor for an optional enumerated field.
     *
     * @param defaultValue default option
     * @param options permitted values
     * @return the descriptor
     */
    public static FieldSpec options(String defaultValue, String... options) {
        return new FieldSpec(false, defaultValue, FieldType.OPTIONS,
                Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(options))));
    }

    /**
     * Returns whether this field carries a default value.
     *
     * @return {@code true} if a default is declared
     */
    public boolean hasDefault() {
        return defaultValue != null;
    }
}
