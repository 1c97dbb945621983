package com.hsbc.randomize.parameters;

import com.hsbc.randomize.distributions.BinomialDistribution;
import com.hsbc.randomize.distributions.CategoricalDistribution;
import com.hsbc.randomize.distributions.DistributionProperties;
import com.hsbc.randomize.distributions.ExponentialDistribution;
import com.hsbc.randomize.distributions.LogNormalDistribution;
import com.hsbc.randomize.distributions.LogisticDistribution;
import com.hsbc.randomize.distributions.NormalDistribution;
import com.hsbc.randomize.distributions.PositiveNormalDistribution;
import com.hsbc.randomize.distributions.SampleStreams;
import com.hsbc.randomize.distributions.UniformDistribution;
import com.hsbc.randomize.generator.RandomNumberGenerator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.stream.DoubleStream;
import javax.annotation.Nonnull;

/**
 * Samples any distribution described by {@link DistributionParameters}, dispatching on its kind.
 *
 * <p>Bounds reach the samplers that honor them: both bounds for the uniform kinds, normal,
 * log-normal and logistic; the maximum alone for exponential and positive normal. Binomial and
 * categorical samples are not bounded, and are all NaN when the probability or a weight is NaN.
 * When a precision is set every finite sample is rounded half-up to that many decimal places.
 */
public final class ParameterizedDistribution {

    private ParameterizedDistribution() {
    }

    /**
     * @param parameters the distribution
     * @return the properties of the distribution, ignoring any precision
     */
    public static DistributionProperties getProperties(@Nonnull DistributionParameters parameters) {
        Objects.requireNonNull(parameters, "parameters");
        switch (parameters.getKind()) {
            case CONTINUOUS_UNIFORM:
                return UniformDistribution.getProperties(lowerBound(parameters), upperBound(parameters));
            case DISCRETE_UNIFORM_SIGNED:
                return UniformDistribution.getDiscreteProperties(signedLower(parameters), signedUpper(parameters));
            case DISCRETE_UNIFORM_UNSIGNED:
                return UniformDistribution.getDiscreteProperties(unsignedLower(parameters), unsignedUpper(parameters));
            case BINOMIAL: {
                BinomialParameters binomial = (BinomialParameters) parameters;
                return BinomialDistribution.getProperties(binomial.getN(), binomial.getP());
            }
            case CATEGORICAL:
                return CategoricalDistribution.getProperties(((CategoricalParameters) parameters).getWeights());
            case EXPONENTIAL:
                return ExponentialDistribution.getProperties(((ExponentialParameters) parameters).getLambda());
            default: {
                LocationScaleParameters locationScale = (LocationScaleParameters) parameters;
                double mu = locationScale.getMu();
                double sigma = locationScale.getSigma();
                switch (locationScale.getKind()) {
                    case POSITIVE_NORMAL:
                        return PositiveNormalDistribution.getProperties(mu, sigma);
                    case LOG_NORMAL:
                        return LogNormalDistribution.getProperties(mu, sigma);
                    case LOGISTIC:
                        return LogisticDistribution.getProperties(mu, sigma);
                    default:
                        return NormalDistribution.getProperties(mu, sigma);
                }
            }
        }
    }

    /**
     * Draws samples of the described distribution.
     *
     * @param generator the source of uniform values
     * @param count the number of samples; non-positive yields an empty stream
     * @param parameters the distribution
     * @return a lazy, single-pass stream of exactly {@code max(0, count)} samples
     * @throws IllegalArgumentException if the bounds are inverted and the generator's range
     *                                  policy is {@code EXCEPTION}
     */
    public static DoubleStream samples(@Nonnull RandomNumberGenerator generator, int count,
                                       @Nonnull DistributionParameters parameters) {
        Objects.requireNonNull(generator, "generator");
        Objects.requireNonNull(parameters, "parameters");
        DoubleStream samples = unrounded(generator, count, parameters);
        Integer precision = parameters.getPrecision();
        return precision == null ? samples : samples.map(value -> round(value, precision));
    }

    private static DoubleStream unrounded(RandomNumberGenerator generator, int count,
                                          DistributionParameters parameters) {
        switch (parameters.getKind()) {
            case CONTINUOUS_UNIFORM:
                return UniformDistribution.samples(generator, count, lowerBound(parameters), upperBound(parameters));
            case DISCRETE_UNIFORM_SIGNED:
                return UniformDistribution.signedSamples(generator, count, signedLower(parameters),
                                                         signedUpper(parameters))
                    .asDoubleStream();
            case DISCRETE_UNIFORM_UNSIGNED:
                return UniformDistribution.unsignedSamples(generator, count, unsignedLower(parameters),
                                                           unsignedUpper(parameters))
                    .asDoubleStream();
            case BINOMIAL: {
                BinomialParameters binomial = (BinomialParameters) parameters;
                if (Double.isNaN(binomial.getP())) {
                    return SampleStreams.constant(count, Double.NaN);
                }
                return BinomialDistribution.samples(generator, count, binomial.getN(), binomial.getP())
                    .asDoubleStream();
            }
            case CATEGORICAL: {
                double[] weights = ((CategoricalParameters) parameters).getWeights();
                if (CategoricalDistribution.hasUndefinedWeight(weights)) {
                    return SampleStreams.constant(count, Double.NaN);
                }
                return CategoricalDistribution.samples(generator, count, weights).asDoubleStream();
            }
            case EXPONENTIAL:
                return ExponentialDistribution.samples(generator, count,
                                                       ((ExponentialParameters) parameters).getLambda(),
                                                       parameters.getMaximum());
            default: {
                LocationScaleParameters locationScale = (LocationScaleParameters) parameters;
                double mu = locationScale.getMu();
                double sigma = locationScale.getSigma();
                switch (locationScale.getKind()) {
                    case POSITIVE_NORMAL:
                        return PositiveNormalDistribution.samples(generator, count, mu, sigma, parameters.getMaximum());
                    case LOG_NORMAL:
                        return LogNormalDistribution.samples(generator, count, mu, sigma, parameters.getMinimum(),
                                                             parameters.getMaximum());
                    case LOGISTIC:
                        return LogisticDistribution.samples(generator, count, mu, sigma, parameters.getMinimum(),
                                                            parameters.getMaximum());
                    default:
                        return NormalDistribution.samples(generator, count, mu, sigma, parameters.getMinimum(),
                                                          parameters.getMaximum());
                }
            }
        }
    }

    /**
     * Rounds half-up to {@code precision} decimal places. NaN and infinities are returned as is.
     */
    static double round(double value, int precision) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP).doubleValue();
    }

    private static double lowerBound(DistributionParameters parameters) {
        return parameters.getMinimum() == null ? Double.NEGATIVE_INFINITY : parameters.getMinimum();
    }

    private static double upperBound(DistributionParameters parameters) {
        return parameters.getMaximum() == null ? Double.POSITIVE_INFINITY : parameters.getMaximum();
    }

    private static int signedLower(DistributionParameters parameters) {
        return (int) clamp(Math.ceil(lowerBound(parameters)), Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    private static int signedUpper(DistributionParameters parameters) {
        return (int) clamp(Math.floor(upperBound(parameters)), Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    private static long unsignedLower(DistributionParameters parameters) {
        return (long) clamp(Math.ceil(lowerBound(parameters)), 0, RandomNumberGenerator.UINT_MAX_VALUE);
    }

    private static long unsignedUpper(DistributionParameters parameters) {
        return (long) clamp(Math.floor(upperBound(parameters)), 0, RandomNumberGenerator.UINT_MAX_VALUE);
    }

    private static double clamp(double value, double lower, double upper) {
        return Math.max(lower, Math.min(upper, value));
    }
}
