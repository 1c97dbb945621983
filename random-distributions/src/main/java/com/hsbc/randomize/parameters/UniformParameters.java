package com.hsbc.randomize.parameters;

import javax.annotation.Nullable;

/**
 * Parameters of the uniform kinds, which are described by their bounds alone. For the discrete
 * kinds the bounds are inclusive and are rounded inwards to whole numbers when sampling.
 */
public final class UniformParameters extends DistributionParameters {

    private final DistributionKind kind;

    UniformParameters(DistributionKind kind, @Nullable Double minimum, @Nullable Double maximum,
                      @Nullable Integer precision) {
        super(minimum, maximum, precision);
        if (kind != DistributionKind.CONTINUOUS_UNIFORM
            && kind != DistributionKind.DISCRETE_UNIFORM_SIGNED
            && kind != DistributionKind.DISCRETE_UNIFORM_UNSIGNED) {
            throw new IllegalArgumentException("Not a uniform kind: " + kind);
        }
        this.kind = kind;
    }

    @Override
    public DistributionKind getKind() {
        return kind;
    }

    @Override
    public double[] getShapeParameters() {
        return new double[0];
    }
}
