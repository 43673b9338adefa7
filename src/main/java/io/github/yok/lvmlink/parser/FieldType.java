package io.github.yok.lvmlink.parser;

import java.time.LocalDate;
import java.time.LocalTime;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Declared type of an LVM header field.
 *
 * <p>
 * Each constant records the Java type a successfully coerced value of that kind has. This is what
 * {@link HeaderSchema} checks default values against and what the cache uses to restore typed
 * values.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum FieldType {

    // Float narrowed to Long when integral.
    NUMBER(Number.class),

    // Base-10 integer.
    INTEGER(Integer.class),

    // Float, never narrowed.
    FLOAT(Double.class),

    // Enumerated text; membership is checked by HeaderValidator.
    OPTIONS(String.class),

    // Free text with hex-escaped delimiters.
    TEXT(String.class),

    // YYYY/MM/DD.
    DATE(LocalDate.class),

    // HH:MM:SS with optional fractional seconds.
    TIME(LocalTime.class),

    // Yes / No.
    BOOL(Boolean.class),

    // Field without a declared type; always yields an empty string.
    NONE(String.class);

    // Java type produced by a successful coercion
    private final Class<?> valueType;

    /**
     * Returns whether the given value is an instance of this type's Java representation.
     *
     * @param value value to test
     * @return {@code true} if {@code value} is non-null and assignable to {@link #getValueType()}
     */
    public boolean accepts(Object value) {
        return value != null && valueType.isInstance(value);
    }
}
