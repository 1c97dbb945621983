package com.hsbc.randomize.parameters;

import com.hsbc.randomize.NumberTolerance;
import javax.annotation.Nullable;

/**
 * Parameters of an exponential distribution with rate {@code lambda}. A rate at or below zero is
 * stored as a tiny positive rate. Only the maximum bound constrains sampling.
 */
public final class ExponentialParameters extends DistributionParameters {

    private final double lambda;

    ExponentialParameters(@Nullable Double minimum, @Nullable Double maximum, double lambda,
                          @Nullable Integer precision) {
        super(minimum, maximum, precision);
        this.lambda = NumberTolerance.atLeastNearlyZero(lambda);
    }

    @Override
    public DistributionKind getKind() {
        return DistributionKind.EXPONENTIAL;
    }

    public double getLambda() {
        return lambda;
    }

    @Override
    public double[] getShapeParameters() {
        return new double[] {lambda};
    }
}
