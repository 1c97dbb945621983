package com.hsbc.randomize.parameters;

import com.hsbc.randomize.NumberTolerance;
import java.util.EnumSet;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Parameters of the location-scale kinds: normal, log-normal, logistic and positive normal. A
 * scale at or below zero is stored as a tiny positive scale. A positive normal distribution
 * starts at {@code mu}, so only its maximum bound constrains sampling.
 */
public final class LocationScaleParameters extends DistributionParameters {

    private static final Set<DistributionKind> KINDS = EnumSet.of(
        DistributionKind.NORMAL, DistributionKind.LOG_NORMAL, DistributionKind.LOGISTIC,
        DistributionKind.POSITIVE_NORMAL);

    private final DistributionKind kind;
    private final double mu;
    private final double sigma;

    LocationScaleParameters(DistributionKind kind, @Nullable Double minimum, @Nullable Double maximum, double mu,
                            double sigma, @Nullable Integer precision) {
        super(minimum, maximum, precision);
        if (!KINDS.contains(kind)) {
            throw new IllegalArgumentException("Not a location-scale kind: " + kind);
        }
        this.kind = kind;
        this.mu = mu;
        this.sigma = NumberTolerance.atLeastNearlyZero(sigma);
    }

    @Override
    public DistributionKind getKind() {
        return kind;
    }

    public double getMu() {
        return mu;
    }

    public double getSigma() {
        return sigma;
    }

    @Override
    public double[] getShapeParameters() {
        return new double[] {mu, sigma};
    }
}
