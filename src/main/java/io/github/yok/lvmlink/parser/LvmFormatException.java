package io.github.yok.lvmlink.parser;

import lombok.Getter;

/**
 * Thrown when an LVM file is structurally malformed.
 *
 * <p>
 * Every instance aborts the parse of the whole file. The {@link ErrorKind} tells callers what went
 * wrong; {@link #getField()} and {@link #getRawValue()} carry the offending header field and raw
 * text when the failure is tied to one.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class LvmFormatException extends Exception {

    private static final long serialVersionUID = 1L;

    // Category of the failure
    private final ErrorKind kind;

    // Header field involved, or null
    private final String field;

    // Raw text that could not be handled, or null
    private final String rawValue;

    /**
     * Creates an exception that is not tied to a specific field.
     *
     * @param kind failure category
     * @param message human-readable message
     */
    public LvmFormatException(ErrorKind kind, String message) {
        this(kind, message, null, null, null);
    }

    /**
     * Creates an exception for a specific field and raw value.
     *
     * @param kind failure category
     * @param message human-readable message
     * @param field header field name
     * @param rawValue raw text that triggered the failure
     */
    public LvmFormatException(ErrorKind kind, String message, String field, String rawValue) {
        this(kind, message, field, rawValue, null);
    }

    /**
     * Creates an exception wrapping a lower-level cause.
     *
     * @param kind failure category
     * @param message human-readable message
     * @param field header field name (may be {@code null})
     * @param rawValue raw text (may be {@code null})
     * @param cause underlying cause (may be {@code null})
     */
    public LvmFormatException(ErrorKind kind, String message, String field, String rawValue,
            Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.field = field;
        this.rawValue = rawValue;
    }
}
