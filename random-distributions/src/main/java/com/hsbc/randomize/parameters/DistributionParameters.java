package com.hsbc.randomize.parameters;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.BinaryOperator;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * An immutable description of a random distribution: its kind, its shape parameters, optional
 * bounds and an optional number of decimal places to round samples to.
 *
 * <p>The hierarchy is closed. Each kind is represented by the subclass carrying exactly its shape
 * fields: {@link UniformParameters}, {@link BinomialParameters}, {@link CategoricalParameters},
 * {@link ExponentialParameters} and {@link LocationScaleParameters}.
 *
 * <p>A minimum of negative infinity and a maximum of positive infinity are the same as no bound
 * and are stored as absent. Equality compares doubles bit-wise, so {@code NaN} equals {@code NaN}
 * and {@code -0.0} differs from {@code 0.0}.
 */
public abstract class DistributionParameters {

    /** The largest number of decimal places a precision may request. */
    public static final int MAX_PRECISION = 255;

    /** The continuous uniform distribution over {@code [0, 1)}. */
    public static final DistributionParameters DEFAULT = new UniformParameters(
        DistributionKind.CONTINUOUS_UNIFORM, 0.0, 1.0, null);

    @Nullable
    private final Double minimum;
    @Nullable
    private final Double maximum;
    @Nullable
    private final Integer precision;

    DistributionParameters(@Nullable Double minimum, @Nullable Double maximum, @Nullable Integer precision) {
        if (precision != null && (precision < 0 || precision > MAX_PRECISION)) {
            throw new IllegalArgumentException(
                String.format("Precision must be between 0 and %d, got: %d", MAX_PRECISION, precision));
        }
        this.minimum = minimum == null || minimum == Double.NEGATIVE_INFINITY ? null : minimum;
        this.maximum = maximum == null || maximum == Double.POSITIVE_INFINITY ? null : maximum;
        this.precision = precision;
    }

    /**
     * Creates parameters of any kind from a flat list of shape parameters in the order the text
     * forms use.
     *
     * @param kind the distribution kind
     * @param minimum the optional minimum
     * @param maximum the optional maximum
     * @param shape the shape parameters; {@code null} is the same as empty
     * @param precision the optional number of decimal places
     * @return the parameters
     * @throws IllegalArgumentException if the number of shape parameters does not fit the kind, or
     *                                  a value is outside its domain
     */
    public static DistributionParameters of(@Nonnull DistributionKind kind, @Nullable Double minimum,
                                            @Nullable Double maximum, @Nullable double[] shape,
                                            @Nullable Integer precision) {
        Objects.requireNonNull(kind, "kind");
        double[] values = shape == null ? new double[0] : shape;
        if (!kind.acceptsParameterCount(values.length)) {
            throw new IllegalArgumentException(String.format(
                "%s does not take %d shape parameter(s)", kind.getDisplayName(), values.length));
        }
        switch (kind) {
            case CONTINUOUS_UNIFORM:
            case DISCRETE_UNIFORM_SIGNED:
            case DISCRETE_UNIFORM_UNSIGNED:
                return new UniformParameters(kind, minimum, maximum, precision);
            case BINOMIAL:
                return new BinomialParameters(minimum, maximum, BinomialParameters.toTrials(values[0]), values[1],
                                              precision);
            case CATEGORICAL:
                return new CategoricalParameters(minimum, maximum, values.length == 0 ? null : values, precision);
            case EXPONENTIAL:
                return new ExponentialParameters(minimum, maximum, values[0], precision);
            default:
                return new LocationScaleParameters(kind, minimum, maximum, values[0], values[1], precision);
        }
    }

    public static UniformParameters continuousUniform() {
        return continuousUniform(0.0, 1.0, null);
    }

    public static UniformParameters continuousUniform(@Nullable Double minimum, @Nullable Double maximum,
                                                      @Nullable Integer precision) {
        return new UniformParameters(DistributionKind.CONTINUOUS_UNIFORM, minimum, maximum, precision);
    }

    public static UniformParameters discreteUniformSigned(@Nullable Double minimum, @Nullable Double maximum) {
        return new UniformParameters(DistributionKind.DISCRETE_UNIFORM_SIGNED, minimum, maximum, null);
    }

    public static UniformParameters discreteUniformUnsigned(@Nullable Double minimum, @Nullable Double maximum) {
        return new UniformParameters(DistributionKind.DISCRETE_UNIFORM_UNSIGNED, minimum, maximum, null);
    }

    /** A signed discrete uniform distribution that always yields {@code value}. */
    public static UniformParameters fixedInt(int value) {
        return discreteUniformSigned((double) value, (double) value);
    }

    /** An unsigned discrete uniform distribution that always yields {@code value}. */
    public static UniformParameters fixedUInt(long value) {
        return discreteUniformUnsigned((double) value, (double) value);
    }

    /** A continuous uniform distribution that always yields {@code value}. */
    public static UniformParameters fixed(double value) {
        return continuousUniform(value, value, null);
    }

    public static BinomialParameters binomial() {
        return binomial(1, 0.5);
    }

    public static BinomialParameters binomial(int n, double p) {
        return new BinomialParameters(null, null, n, p, null);
    }

    /**
     * @param weights the category weights; none means three equal weights
     */
    public static CategoricalParameters categorical(double... weights) {
        return new CategoricalParameters(null, null, weights == null || weights.length == 0 ? null : weights, null);
    }

    public static ExponentialParameters exponential() {
        return exponential(1.0);
    }

    public static ExponentialParameters exponential(double lambda) {
        return exponential(lambda, null, null);
    }

    public static ExponentialParameters exponential(double lambda, @Nullable Double maximum,
                                                    @Nullable Integer precision) {
        return new ExponentialParameters(null, maximum, lambda, precision);
    }

    public static LocationScaleParameters normal() {
        return normal(0.0, 1.0);
    }

    public static LocationScaleParameters normal(double mu, double sigma) {
        return normal(mu, sigma, null, null, null);
    }

    public static LocationScaleParameters normal(double mu, double sigma, @Nullable Double minimum,
                                                 @Nullable Double maximum, @Nullable Integer precision) {
        return new LocationScaleParameters(DistributionKind.NORMAL, minimum, maximum, mu, sigma, precision);
    }

    public static LocationScaleParameters logNormal() {
        return logNormal(0.0, 1.0);
    }

    public static LocationScaleParameters logNormal(double mu, double sigma) {
        return logNormal(mu, sigma, null, null, null);
    }

    public static LocationScaleParameters logNormal(double mu, double sigma, @Nullable Double minimum,
                                                    @Nullable Double maximum, @Nullable Integer precision) {
        return new LocationScaleParameters(DistributionKind.LOG_NORMAL, minimum, maximum, mu, sigma, precision);
    }

    public static LocationScaleParameters logistic() {
        return logistic(0.0, 1.0);
    }

    public static LocationScaleParameters logistic(double mu, double sigma) {
        return logistic(mu, sigma, null, null, null);
    }

    public static LocationScaleParameters logistic(double mu, double sigma, @Nullable Double minimum,
                                                   @Nullable Double maximum, @Nullable Integer precision) {
        return new LocationScaleParameters(DistributionKind.LOGISTIC, minimum, maximum, mu, sigma, precision);
    }

    public static LocationScaleParameters positiveNormal() {
        return positiveNormal(0.0, 1.0);
    }

    public static LocationScaleParameters positiveNormal(double mu, double sigma) {
        return positiveNormal(mu, sigma, null, null);
    }

    public static LocationScaleParameters positiveNormal(double mu, double sigma, @Nullable Double maximum,
                                                         @Nullable Integer precision) {
        return new LocationScaleParameters(DistributionKind.POSITIVE_NORMAL, null, maximum, mu, sigma, precision);
    }

    public abstract DistributionKind getKind();

    /**
     * Gets the shape parameters in the order the text forms use.
     *
     * @return a new array; empty for the uniform kinds
     */
    public abstract double[] getShapeParameters();

    @Nullable
    public Double getMinimum() {
        return minimum;
    }

    @Nullable
    public Double getMaximum() {
        return maximum;
    }

    @Nullable
    public Integer getPrecision() {
        return precision;
    }

    public DistributionParameters withBounds(@Nullable Double minimum, @Nullable Double maximum) {
        return of(getKind(), minimum, maximum, getShapeParameters(), precision);
    }

    public DistributionParameters withPrecision(@Nullable Integer precision) {
        return of(getKind(), minimum, maximum, getShapeParameters(), precision);
    }

    /**
     * Combines these parameters with another set. The result takes the kind with the higher
     * index, the lower minimum, the higher maximum and the higher precision; a value present on
     * one side only is taken as is. When both sides are the same kind their shape parameters are
     * averaged position-wise, a missing categorical weight counting as zero; otherwise the shape
     * parameters of the chosen kind are kept.
     *
     * @param other the parameters to combine with
     * @return the combined parameters
     */
    public DistributionParameters combine(@Nonnull DistributionParameters other) {
        Objects.requireNonNull(other, "other");
        DistributionParameters chosen = other.getKind().getIndex() > getKind().getIndex() ? other : this;

        double[] shape;
        if (other.getKind() == getKind()) {
            double[] mine = getShapeParameters();
            double[] theirs = other.getShapeParameters();
            shape = new double[Math.max(mine.length, theirs.length)];
            for (int i = 0; i < shape.length; i++) {
                double first = i < mine.length ? mine[i] : 0.0;
                double second = i < theirs.length ? theirs[i] : 0.0;
                shape[i] = (first + second) / 2.0;
            }
        } else {
            shape = chosen.getShapeParameters();
        }

        return of(chosen.getKind(),
                  pick(minimum, other.minimum, Math::min),
                  pick(maximum, other.maximum, Math::max),
                  shape,
                  pick(precision, other.precision, Math::max));
    }

    private static <T> T pick(@Nullable T first, @Nullable T second, BinaryOperator<T> choose) {
        if (first == null) {
            return second;
        }
        return second == null ? first : choose.apply(first, second);
    }

    @Override
    public final boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DistributionParameters)) return false;
        DistributionParameters that = (DistributionParameters) obj;
        return getKind() == that.getKind()
            && Objects.equals(minimum, that.minimum)
            && Objects.equals(maximum, that.maximum)
            && Objects.equals(precision, that.precision)
            && Arrays.equals(getShapeParameters(), that.getShapeParameters());
    }

    @Override
    public final int hashCode() {
        return 31 * Objects.hash(getKind(), minimum, maximum, precision) + Arrays.hashCode(getShapeParameters());
    }

    /**
     * Renders the parameters in the general text form, using the default locale.
     */
    @Override
    public String toString() {
        return ParameterCodec.format(this, ParameterCodec.GENERAL);
    }
}
