package io.github.yok.lvmlink.parser;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Converts raw LVM text tokens into typed values.
 *
 * <p>
 * The result distinguishes two outcomes that must not be conflated:
 * </p>
 * <ul>
 * <li>{@link Optional#empty()}: the token carries no value (blank or unparseable numeric). Callers
 * decide whether that is acceptable; for a data sample it simply means "no sample".</li>
 * <li>{@link LvmFormatException}: the token claims a value of the declared type but is malformed
 * (bad date, bad time, unknown boolean literal).</li>
 * </ul>
 *
 * <p>
 * All methods are pure functions of their arguments.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class FieldValueParser {

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu/M/d", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("H:m:s", Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT);

    // Plain decimal / scientific notation after the decimal separator was normalized to '.'
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern NON_FINITE = Pattern.compile("[+-]?(inf|infinity|nan)",
            Pattern.CASE_INSENSITIVE);

    // Sub-microsecond digits are dropped
    private static final int MAX_FRACTION_DIGITS = 6;

    @Generated
    private FieldValueParser() {
        throw new AssertionError(
                "No io.github.yok.lvmlink.parser.FieldValueParser instances for you!");
    }

    /**
     * Coerces a raw token according to its declared type.
     *
     * @param value raw token (never {@code null})
     * @param type declared type; {@code null} behaves like {@link FieldType#NONE}
     * @param separator active field delimiter, used to unescape text
     * @param decimalSeparator active decimal separator
     * @return the typed value, or empty when the token carries no value
     * @throws LvmFormatException if the token is a malformed date, time or boolean
     */
    public static Optional<Object> parse(String value, FieldType type, char separator,
            String decimalSeparator) throws LvmFormatException {
        if (type == null) {
            return Optional.of("");
        }
        switch (type) {
            case NUMBER:
                return parseNumber(value, decimalSeparator).map(Object.class::cast);
            case INTEGER:
                return parseInteger(value).map(Object.class::cast);
            case FLOAT:
                return parseFloat(value, decimalSeparator).map(Object.class::cast);
            case OPTIONS:
                return Optional.of(value);
            case TEXT:
                return Optional.of(unescapeText(value, separator));
            case DATE:
                return Optional.of(parseDate(value));
            case TIME:
                return Optional.of(parseTime(value, decimalSeparator));
            case BOOL:
                return Optional.of(parseBool(value));
            case NONE:
            default:
                return Optional.of("");
        }
    }

    /**
     * Parses a floating-point token after replacing the decimal separator with {@code '.'}.
     *
     * <p>
     * Accepts plain and scientific notation as well as {@code inf}/{@code infinity}/{@code nan}
     * (case-insensitive, optionally signed). Surrounding whitespace is ignored.
     * </p>
     *
     * @param value raw token
     * @param decimalSeparator active decimal separator
     * @return the value, or empty if the token is blank or not a number
     */
    public static Optional<Double> parseFloat(String value, String decimalSeparator) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        String normalized = StringUtils.isEmpty(decimalSeparator) ? value.trim()
                : value.replace(decimalSeparator, ".").trim();
        if (DECIMAL.matcher(normalized).matches()) {
            return Optional.of(Double.parseDouble(normalized));
        }
        if (NON_FINITE.matcher(normalized).matches()) {
            String lower = normalized.toLowerCase(Locale.ROOT);
            if (lower.endsWith("nan")) {
                return Optional.of(Double.NaN);
            }
            return Optional.of(lower.startsWith("-") ? Double.NEGATIVE_INFINITY
                    : Double.POSITIVE_INFINITY);
        }
        return Optional.empty();
    }

    /**
     * Parses a number, narrowing it to {@link Long} when it has no fractional part.
     *
     * @param value raw token
     * @param decimalSeparator active decimal separator
     * @return a {@link Long} or {@link Double}, or empty if the token is blank or not a number
     */
    public static Optional<Number> parseNumber(String value, String decimalSeparator) {
        Optional<Double> parsed = parseFloat(value, decimalSeparator);
        if (!parsed.isPresent()) {
            return Optional.empty();
        }
        double d = parsed.get();
        if (!Double.isInfinite(d) && d == Math.rint(d) && d >= Long.MIN_VALUE
                && d <= Long.MAX_VALUE) {
            return Optional.of((long) d);
        }
        return Optional.of(d);
    }

    /**
     * Parses a base-10 integer.
     *
     * @param value raw token
     * @return the value, or empty if the token is not an integer
     */
    public static Optional<Integer> parseInteger(String value) {
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Replaces hex-escaped delimiters ({@code \2C} or {@code \2c} for a comma) with the delimiter.
     *
     * @param value raw text
     * @param separator active field delimiter
     * @return unescaped text; identical to {@code value} when it holds no escape
     */
    public static String unescapeText(String value, char separator) {
        String hex = String.format("%02X", (int) separator);
        String upper = "\\" + hex;
        String lower = "\\" + hex.toLowerCase(Locale.ROOT);
        String sep = String.valueOf(separator);
        return value.replace(upper, sep).replace(lower, sep);
    }

    /**
     * Parses a {@code YYYY/MM/DD} date.
     *
     * @param value raw token
     * @return the date
     * @throws LvmFormatException if the token is not a valid date
     */
    public static LocalDate parseDate(String value) throws LvmFormatException {
        try {
            return LocalDate.parse(value.trim(), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new LvmFormatException(ErrorKind.FIELD_COERCION_FAILURE,
                    "Invalid date '" + value + "', expected YYYY/MM/DD", null, value, e);
        }
    }

    /**
     * Parses an {@code HH:MM:SS} time with optional fractional seconds after the decimal
     * separator. Fractions longer than six digits are truncated.
     *
     * @param value raw token
     * @param decimalSeparator active decimal separator
     * @return the time of day
     * @throws LvmFormatException if the token is not a valid time
     */
    public static LocalTime parseTime(String value, String decimalSeparator)
            throws LvmFormatException {
        String clock = value.trim();
        String fraction = null;
        if (StringUtils.isNotEmpty(decimalSeparator) && clock.contains(decimalSeparator)) {
            String[] parts = StringUtils.splitByWholeSeparatorPreserveAllTokens(clock,
                    decimalSeparator);
            if (parts.length != 2 || !StringUtils.isNumeric(parts[1])) {
                throw new LvmFormatException(ErrorKind.FIELD_COERCION_FAILURE,
                        "Invalid time '" + value + "', expected HH:MM:SS" + decimalSeparator
                                + "ffffff",
                        null, value);
            }
            clock = parts[0];
            fraction = StringUtils.rightPad(StringUtils.left(parts[1], MAX_FRACTION_DIGITS),
                    MAX_FRACTION_DIGITS, '0');
        }
        try {
            LocalTime time = LocalTime.parse(clock, TIME_FORMAT);
            if (fraction != null) {
                time = time.withNano(Integer.parseInt(fraction) * 1000);
            }
            return time;
        } catch (DateTimeParseException e) {
            throw new LvmFormatException(ErrorKind.FIELD_COERCION_FAILURE,
                    "Invalid time '" + value + "', expected HH:MM:SS", null, value, e);
        }
    }

    /**
     * Parses a {@code Yes}/{@code No} literal.
     *
     * @param value raw token
     * @return {@code true} for {@code Yes}, {@code false} for {@code No}
     * @throws LvmFormatException for any other token
     */
    public static boolean parseBool(String value) throws LvmFormatException {
        if ("Yes".equals(value)) {
            return true;
        }
        if ("No".equals(value)) {
            return false;
        }
        throw new LvmFormatException(ErrorKind.FIELD_COERCION_FAILURE,
                "Invalid boolean '" + value + "', expected Yes or No", null, value);
    }
}
