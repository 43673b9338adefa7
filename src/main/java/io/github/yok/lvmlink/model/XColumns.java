package io.github.yok.lvmlink.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Layout of the X axis in a segment's data table, as declared by the {@code X_Columns} file
 * header.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum XColumns {

    // No X column; X is computed from X0 and Delta_X.
    NO("No"),

    // One shared X column in front of the Y columns.
    ONE("One"),

    // One X column before every Y column.
    MULTI("Multi");

    // Literal used in the file header
    private final String label;

    /**
     * Resolves the constant for a header literal.
     *
     * @param label {@code No}, {@code One} or {@code Multi}
     * @return matching constant
     * @throws IllegalArgumentException if the literal is unknown
     */
    public static XColumns fromLabel(String label) {
        for (XColumns mode : values()) {
            if (mode.label.equals(label)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported X_Columns: " + label);
    }
}
