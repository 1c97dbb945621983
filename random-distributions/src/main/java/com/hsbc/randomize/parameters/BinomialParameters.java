package com.hsbc.randomize.parameters;

import javax.annotation.Nullable;

/**
 * Parameters of a binomial distribution: {@code n} trials with success probability {@code p}.
 */
public final class BinomialParameters extends DistributionParameters {

    private final int n;
    private final double p;

    BinomialParameters(@Nullable Double minimum, @Nullable Double maximum, int n, double p,
                       @Nullable Integer precision) {
        super(minimum, maximum, precision);
        if (n < 0) {
            throw new IllegalArgumentException("The number of trials cannot be negative: " + n);
        }
        this.n = n;
        this.p = p;
    }

    static int toTrials(double value) {
        if (!(value >= 0) || value > Integer.MAX_VALUE || value != Math.rint(value)) {
            throw new IllegalArgumentException("The number of trials must be a non-negative integer: " + value);
        }
        return (int) value;
    }

    @Override
    public DistributionKind getKind() {
        return DistributionKind.BINOMIAL;
    }

    public int getN() {
        return n;
    }

    /**
     * The success probability as given. Sampling clamps it to [0, 1].
     */
    public double getP() {
        return p;
    }

    @Override
    public double[] getShapeParameters() {
        return new double[] {n, p};
    }
}
