package com.hsbc.randomize.parameters;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.ParsePosition;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The general, human-readable text form:
 * {@code <Kind> distribution (<minimum>;<maximum>) [<p0>;<p1>...] r:<precision>}.
 *
 * <p>Numbers are rendered with two decimal places in a given locale, so this form does not
 * preserve values exactly. The bounds group is left out when both bounds are absent, the
 * parameter group when there are no shape parameters and the precision group when no precision
 * is set.
 *
 * <p>Infinities are written with the infinity symbol of the locale. Parsing accepts that symbol as
 * well as the literals {@code Infinity} and {@code -Infinity}.
 */
final class GeneralGrammar {

    private static final String MARKER = " distribution";

    private static final Pattern DIGITS = Pattern.compile("\\d{1,9}");

    private GeneralGrammar() {
    }

    static String format(DistributionParameters value, Locale locale) {
        DecimalFormat numberFormat = numberFormat(locale);
        StringBuilder builder = new StringBuilder(value.getKind().getDisplayName()).append(MARKER);
        if (value.getMinimum() != null || value.getMaximum() != null) {
            double minimum = value.getMinimum() == null ? Double.NEGATIVE_INFINITY : value.getMinimum();
            double maximum = value.getMaximum() == null ? Double.POSITIVE_INFINITY : value.getMaximum();
            builder.append(" (")
                .append(formatNumber(minimum, numberFormat))
                .append(';')
                .append(formatNumber(maximum, numberFormat))
                .append(')');
        }
        double[] shape = value.getShapeParameters();
        if (shape.length > 0) {
            builder.append(" [");
            for (int i = 0; i < shape.length; i++) {
                if (i > 0) {
                    builder.append(';');
                }
                builder.append(formatNumber(shape[i], numberFormat));
            }
            builder.append(']');
        }
        if (value.getPrecision() != null) {
            builder.append(" r:").append(value.getPrecision());
        }
        return builder.toString();
    }

    /**
     * @throws ParameterFormatException if the text is not in the general form
     */
    static DistributionParameters parse(String text, Locale locale) {
        String trimmed = text.trim();
        int marker = trimmed.indexOf(MARKER);
        if (marker <= 0) {
            throw new ParameterFormatException("Missing distribution name in '" + trimmed + "'");
        }
        String name = trimmed.substring(0, marker).trim();
        DistributionKind kind = DistributionKind.fromDisplayName(name)
            .orElseThrow(() -> new ParameterFormatException("Unknown distribution: " + name));

        DecimalFormat numberFormat = numberFormat(locale);
        TextCursor cursor = new TextCursor(trimmed.substring(marker + MARKER.length()));
        Double minimum = null;
        Double maximum = null;
        double[] shape = new double[0];
        Integer precision = null;

        cursor.skipWhitespace();
        if (cursor.consume('(')) {
            minimum = parseNumber(field(cursor, ';', "minimum"), numberFormat);
            maximum = parseNumber(field(cursor, ')', "maximum"), numberFormat);
            cursor.skipWhitespace();
        }
        if (cursor.consume('[')) {
            String[] parts = field(cursor, ']', "parameters").split(";", -1);
            if (!(parts.length == 1 && parts[0].trim().isEmpty())) {
                shape = new double[parts.length];
                for (int i = 0; i < parts.length; i++) {
                    shape[i] = parseNumber(parts[i], numberFormat);
                }
            }
            cursor.skipWhitespace();
        }
        if (cursor.consume('r')) {
            if (!cursor.consume(':')) {
                throw new ParameterFormatException("Missing ':' after 'r' at position " + cursor.position());
            }
            String precisionField = cursor.readRemaining().trim();
            if (!DIGITS.matcher(precisionField).matches()) {
                throw new ParameterFormatException("Invalid precision: '" + precisionField + "'");
            }
            precision = Integer.parseInt(precisionField);
        }
        if (!cursor.atEnd()) {
            throw new ParameterFormatException("Unexpected text at position " + cursor.position());
        }

        try {
            return DistributionParameters.of(kind, minimum, maximum, shape, precision);
        } catch (IllegalArgumentException e) {
            throw new ParameterFormatException(e.getMessage(), e);
        }
    }

    private static String field(TextCursor cursor, char terminator, String name) {
        String value = cursor.readUntil(terminator);
        if (value == null || !cursor.consume(terminator)) {
            throw new ParameterFormatException("Missing " + name + " at position " + cursor.position());
        }
        return value;
    }

    private static DecimalFormat numberFormat(Locale locale) {
        DecimalFormat numberFormat = new DecimalFormat("0.00", DecimalFormatSymbols.getInstance(locale));
        numberFormat.setRoundingMode(RoundingMode.HALF_UP);
        return numberFormat;
    }

    private static String formatNumber(double value, DecimalFormat numberFormat) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return numberFormat.format(value);
    }

    private static double parseNumber(String text, DecimalFormat numberFormat) {
        String trimmed = text.trim();
        switch (trimmed) {
            case "NaN":
                return Double.NaN;
            case "Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                ParsePosition position = new ParsePosition(0);
                Number number = numberFormat.parse(trimmed, position);
                if (number == null || trimmed.isEmpty() || position.getIndex() != trimmed.length()) {
                    throw new ParameterFormatException("Invalid number: '" + text + "'");
                }
                return number.doubleValue();
        }
    }
}
