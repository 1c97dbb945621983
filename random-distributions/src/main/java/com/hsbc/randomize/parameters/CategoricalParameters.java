package com.hsbc.randomize.parameters;

import com.hsbc.randomize.distributions.CategoricalDistribution;
import javax.annotation.Nullable;

/**
 * Parameters of a categorical distribution. Weights are stored normalized; absent weights mean
 * three equally likely categories and a NaN weight leaves every weight undefined.
 */
public final class CategoricalParameters extends DistributionParameters {

    private final double[] weights;

    /**
     * @throws IllegalArgumentException if no weight is positive
     */
    CategoricalParameters(@Nullable Double minimum, @Nullable Double maximum, @Nullable double[] weights,
                          @Nullable Integer precision) {
        super(minimum, maximum, precision);
        this.weights = CategoricalDistribution.normalize(weights == null ? new double[0] : weights);
    }

    @Override
    public DistributionKind getKind() {
        return DistributionKind.CATEGORICAL;
    }

    public int getCategoryCount() {
        return weights.length;
    }

    public double[] getWeights() {
        return weights.clone();
    }

    @Override
    public double[] getShapeParameters() {
        return weights.clone();
    }
}
