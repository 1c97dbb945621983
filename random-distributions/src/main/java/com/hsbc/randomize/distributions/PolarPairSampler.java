package com.hsbc.randomize.distributions;

import com.hsbc.randomize.NumberTolerance;
import com.hsbc.randomize.generator.RandomNumberGenerator;
import java.util.function.DoubleSupplier;
import java.util.function.DoubleUnaryOperator;

/**
 * Polar Box-Muller sampling shared by the normal family. Deviates are produced in pairs and
 * served in order; a pair is redrawn whole when either of its values falls outside the bounds.
 * Not thread-safe: one instance backs one stream.
 */
final class PolarPairSampler implements DoubleSupplier {

    private final RandomNumberGenerator generator;
    private final double mu;
    private final double sigma;
    private final boolean folded;
    private final DoubleUnaryOperator transform;
    private final SampleBounds bounds;

    private boolean hasPending;
    private double pending;

    /**
     * @param folded whether deviates are reflected onto the non-negative side of {@code mu}
     * @param transform applied to each value before the bounds check
     */
    PolarPairSampler(RandomNumberGenerator generator, double mu, double sigma, boolean folded,
                     DoubleUnaryOperator transform, SampleBounds bounds) {
        this.generator = generator;
        this.mu = mu;
        this.sigma = sigma;
        this.folded = folded;
        this.transform = transform;
        this.bounds = bounds;
    }

    @Override
    public double getAsDouble() {
        if (hasPending) {
            hasPending = false;
            return pending;
        }
        double first;
        double second;
        do {
            double u;
            double v;
            double s;
            do {
                u = generator.nextDouble(-1.0, 1.0);
                v = generator.nextDouble(-1.0, 1.0);
                s = u * u + v * v;
            } while (NumberTolerance.isNearlyZero(s) || s >= 1.0);
            double factor = Math.sqrt(-2.0 * Math.log(s) / s) * sigma;
            first = transform.applyAsDouble(mu + deviate(u * factor));
            second = transform.applyAsDouble(mu + deviate(v * factor));
        } while (!bounds.contains(first) || !bounds.contains(second));
        pending = second;
        hasPending = true;
        return first;
    }

    private double deviate(double value) {
        return folded ? Math.abs(value) : value;
    }
}
