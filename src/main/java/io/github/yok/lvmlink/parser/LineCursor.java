package io.github.yok.lvmlink.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import org.apache.commons.lang3.StringUtils;

/**
 * Forward-only cursor over an indexable buffer of file lines.
 *
 * <p>
 * Lines are returned with their {@code \r} and {@code \n} characters removed. Lookahead via
 * {@link #peek(int)} never moves the cursor, so a pre-scan can inspect lines that a later reader
 * consumes normally.
 * </p>
 *
 * <p>
 * Not thread-safe; one cursor belongs to one parse.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class LineCursor {

    private final List<String> lines;

    // Index of the next line to return
    private int position;

    /**
     * Creates a cursor over the given lines. Line terminators may or may not be present.
     *
     * @param lines file lines (copied)
     */
    public LineCursor(List<String> lines) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    /**
     * Creates a cursor over the lines of an in-memory text. Splits on {@code \n}, {@code \r\n} and
     * {@code \r}; a trailing terminator does not produce an extra empty line.
     *
     * @param text file content
     * @return cursor positioned at the first line
     */
    public static LineCursor fromText(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int len = text.length();
        for (int i = 0; i < len; i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                lines.add(text.substring(start, i));
                if (c == '\r' && i + 1 < len && text.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
        }
        if (start < len) {
            lines.add(text.substring(start));
        }
        return new LineCursor(lines);
    }

    /**
     * Returns whether another line is available.
     *
     * @return {@code true} unless the input is exhausted
     */
    public boolean hasNext() {
        return position < lines.size();
    }

    /**
     * Consumes and returns the next line.
     *
     * @return the line without terminators
     * @throws NoSuchElementException if the input is exhausted
     */
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more lines at index " + position);
        }
        return strip(lines.get(position++));
    }

    /**
     * Returns the line {@code offset} positions ahead without consuming anything.
     *
     * @param offset 0 for the next line, 1 for the one after, ...
     * @return the line without terminators, or {@code null} if beyond the end of input
     */
    public String peek(int offset) {
        int index = position + offset;
        if (offset < 0 || index >= lines.size()) {
            return null;
        }
        return strip(lines.get(index));
    }

    /**
     * Returns whether every remaining line is empty.
     *
     * @return {@code true} if the input is exhausted or only blank lines remain
     */
    public boolean onlyBlankLinesRemain() {
        for (int i = position; i < lines.size(); i++) {
            if (!strip(lines.get(i)).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the zero-based index of the next line; useful for error messages.
     *
     * @return current position
     */
    public int position() {
        return position;
    }

    private static String strip(String line) {
        return StringUtils.replaceChars(line, "\r\n", "");
    }
}
