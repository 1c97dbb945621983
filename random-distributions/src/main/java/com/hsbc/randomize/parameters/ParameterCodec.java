package com.hsbc.randomize.parameters;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts {@link DistributionParameters} to and from text.
 *
 * <p>Two forms are supported, identified by a case-insensitive format string:
 * <ul>
 *   <li>{@code "g"}, the general form, readable and locale-sensitive, rounded to two decimal
 *       places: {@code Normal distribution (0.00;10.00) [5.00;2.00] r:2}</li>
 *   <li>{@code "r"}, the round-trip form, locale-invariant and exact:
 *       {@code 9:0;10:5;2:2}</li>
 * </ul>
 * A {@code null} or blank format string means {@code "g"}. Parsing round-trip text produced by
 * {@link #format(DistributionParameters, String)} gives back equal parameters.
 */
public final class ParameterCodec {

    public static final String GENERAL = "g";
    public static final String ROUND_TRIP = "r";

    private static final Logger log = LoggerFactory.getLogger(ParameterCodec.class);

    private ParameterCodec() {
    }

    public static String format(@Nonnull DistributionParameters value, @Nullable String format) {
        return format(value, format, Locale.getDefault());
    }

    /**
     * Formats parameters as text.
     *
     * @param value the parameters
     * @param format {@code "g"} or {@code "r"}; {@code null} or blank means {@code "g"}
     * @param locale the locale for the general form; ignored by the round-trip form
     * @return the text
     * @throws IllegalArgumentException if the format is not recognized
     */
    public static String format(@Nonnull DistributionParameters value, @Nullable String format,
                                @Nonnull Locale locale) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(locale, "locale");
        return isRoundTrip(format) ? RoundTripGrammar.format(value) : GeneralGrammar.format(value, locale);
    }

    public static DistributionParameters parse(@Nonnull String text) {
        return parse(text, Locale.getDefault());
    }

    /**
     * Parses text in either form, trying the general form first.
     *
     * @throws ParameterFormatException if the text is in neither form
     */
    public static DistributionParameters parse(@Nonnull String text, @Nonnull Locale locale) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(locale, "locale");
        checkNotBlank(text);
        try {
            return GeneralGrammar.parse(text, locale);
        } catch (ParameterFormatException general) {
            try {
                return RoundTripGrammar.parse(text);
            } catch (ParameterFormatException roundTrip) {
                roundTrip.addSuppressed(general);
                throw new ParameterFormatException("Not valid distribution parameters: '" + text + "'", roundTrip);
            }
        }
    }

    public static DistributionParameters parseExact(@Nonnull String text, @Nullable String format) {
        return parseExact(text, format, Locale.getDefault());
    }

    /**
     * Parses text in one form only.
     *
     * @throws ParameterFormatException if the text is not in the given form
     * @throws IllegalArgumentException if the format is not recognized
     */
    public static DistributionParameters parseExact(@Nonnull String text, @Nullable String format,
                                                    @Nonnull Locale locale) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(locale, "locale");
        boolean roundTrip = isRoundTrip(format);
        checkNotBlank(text);
        return roundTrip ? RoundTripGrammar.parse(text) : GeneralGrammar.parse(text, locale);
    }

    public static Optional<DistributionParameters> tryParse(@Nullable String text) {
        return tryParse(text, Locale.getDefault());
    }

    /**
     * Parses text in either form.
     *
     * @return the parameters, or empty if the text is {@code null}, blank, or in neither form
     */
    public static Optional<DistributionParameters> tryParse(@Nullable String text, @Nonnull Locale locale) {
        if (text == null || text.trim().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(text, locale));
        } catch (ParameterFormatException e) {
            log.debug("Rejected distribution parameters {}", text, e);
            return Optional.empty();
        }
    }

    public static Optional<DistributionParameters> tryParseExact(@Nullable String text, @Nullable String format) {
        return tryParseExact(text, format, Locale.getDefault());
    }

    /**
     * Parses text in one form only.
     *
     * @return the parameters, or empty if the text is {@code null}, blank, or not in the form
     * @throws IllegalArgumentException if the format is not recognized
     */
    public static Optional<DistributionParameters> tryParseExact(@Nullable String text, @Nullable String format,
                                                                 @Nonnull Locale locale) {
        boolean roundTrip = isRoundTrip(format);
        if (text == null || text.trim().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(roundTrip ? RoundTripGrammar.parse(text) : GeneralGrammar.parse(text, locale));
        } catch (ParameterFormatException e) {
            log.debug("Rejected distribution parameters '{}' in format '{}': {}", text, format, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isRoundTrip(@Nullable String format) {
        if (format == null || format.trim().isEmpty() || GENERAL.equalsIgnoreCase(format.trim())) {
            return false;
        }
        if (ROUND_TRIP.equalsIgnoreCase(format.trim())) {
            return true;
        }
        throw new IllegalArgumentException("The provided format is not recognized: '" + format + "'");
    }

    private static void checkNotBlank(String text) {
        if (text.trim().isEmpty()) {
            throw new ParameterFormatException("Distribution parameters cannot be blank");
        }
    }
}
