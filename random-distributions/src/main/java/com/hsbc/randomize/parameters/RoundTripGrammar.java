package com.hsbc.randomize.parameters;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * The round-trip text form:
 * {@code <kind-index>:<minimum>;<maximum>:<p0>;<p1>...:<precision>}.
 *
 * <p>Numbers carry 17 significant digits, which is enough for any double to parse back to the
 * same bits. They are written in plain notation when the decimal exponent is in {@code (-5, 17)}
 * and as {@code d.dddE+XX} otherwise. An absent minimum is {@code -Infinity}, an absent maximum
 * {@code Infinity} and an absent precision the empty string.
 */
final class RoundTripGrammar {

    private static final MathContext SIGNIFICANT_DIGITS = new MathContext(17, RoundingMode.HALF_UP);

    private static final Pattern NUMBER =
        Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|NaN|-?Infinity");

    private static final Pattern DIGITS = Pattern.compile("\\d{1,9}");

    private RoundTripGrammar() {
    }

    static String format(DistributionParameters value) {
        StringBuilder builder = new StringBuilder();
        builder.append(value.getKind().getIndex()).append(':');
        builder.append(value.getMinimum() == null ? "-Infinity" : formatNumber(value.getMinimum())).append(';');
        builder.append(value.getMaximum() == null ? "Infinity" : formatNumber(value.getMaximum())).append(':');
        double[] shape = value.getShapeParameters();
        for (int i = 0; i < shape.length; i++) {
            if (i > 0) {
                builder.append(';');
            }
            builder.append(formatNumber(shape[i]));
        }
        builder.append(':');
        if (value.getPrecision() != null) {
            builder.append(value.getPrecision());
        }
        return builder.toString();
    }

    /**
     * @throws ParameterFormatException if the text is not in the round-trip form
     */
    static DistributionParameters parse(String text) {
        TextCursor cursor = new TextCursor(text.trim());

        String kindField = field(cursor, ':', "kind");
        String minimumField = field(cursor, ';', "minimum");
        String maximumField = field(cursor, ':', "maximum");
        String shapeField = field(cursor, ':', "parameters");
        String precisionField = cursor.readRemaining();

        if (!DIGITS.matcher(kindField).matches()) {
            throw new ParameterFormatException("Invalid distribution kind: '" + kindField + "'");
        }
        DistributionKind kind = DistributionKind.fromIndex(Integer.parseInt(kindField))
            .orElseThrow(() -> new ParameterFormatException("Unknown distribution kind: " + kindField));

        double[] shape;
        if (shapeField.isEmpty()) {
            shape = new double[0];
        } else {
            String[] parts = shapeField.split(";", -1);
            shape = new double[parts.length];
            for (int i = 0; i < parts.length; i++) {
                shape[i] = parseNumber(parts[i]);
            }
        }

        Integer precision = null;
        if (!precisionField.isEmpty()) {
            if (!DIGITS.matcher(precisionField).matches()) {
                throw new ParameterFormatException("Invalid precision: '" + precisionField + "'");
            }
            precision = Integer.parseInt(precisionField);
        }

        try {
            return DistributionParameters.of(kind, parseNumber(minimumField), parseNumber(maximumField), shape,
                                             precision);
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

    static double parseNumber(String text) {
        if (!NUMBER.matcher(text).matches()) {
            throw new ParameterFormatException("Invalid number: '" + text + "'");
        }
        return Double.parseDouble(text);
    }

    static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == 0.0) {
            return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
        }

        BigDecimal rounded = new BigDecimal(value).round(SIGNIFICANT_DIGITS).stripTrailingZeros();
        int exponent = rounded.precision() - rounded.scale() - 1;
        if (exponent > -5 && exponent < SIGNIFICANT_DIGITS.getPrecision()) {
            return rounded.toPlainString();
        }

        String digits = rounded.unscaledValue().abs().toString();
        StringBuilder builder = new StringBuilder();
        if (rounded.signum() < 0) {
            builder.append('-');
        }
        builder.append(digits.charAt(0));
        if (digits.length() > 1) {
            builder.append('.').append(digits, 1, digits.length());
        }
        builder.append('E').append(exponent < 0 ? '-' : '+');
        int magnitude = Math.abs(exponent);
        if (magnitude < 10) {
            builder.append('0');
        }
        return builder.append(magnitude).toString();
    }
}
