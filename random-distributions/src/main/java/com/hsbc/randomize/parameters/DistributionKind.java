package com.hsbc.randomize.parameters;

import java.util.Optional;

/**
 * The distribution kinds a {@link DistributionParameters} can describe. The index is the kind's
 * identifier in the round-trip text form and its rank when parameters are combined.
 */
public enum DistributionKind {
    CONTINUOUS_UNIFORM(0, "ContinuousUniform", 0),
    DISCRETE_UNIFORM_SIGNED(1, "DiscreteUniformSigned", 0),
    DISCRETE_UNIFORM_UNSIGNED(2, "DiscreteUniformUnsigned", 0),
    BINOMIAL(3, "Binomial", 2),
    CATEGORICAL(4, "Categorical", -1),
    POSITIVE_NORMAL(5, "PositiveNormal", 2),
    EXPONENTIAL(6, "Exponential", 1),
    LOG_NORMAL(7, "LogNormal", 2),
    LOGISTIC(8, "Logistic", 2),
    NORMAL(9, "Normal", 2);

    private final int index;
    private final String displayName;
    private final int parameterCount;

    DistributionKind(int index, String displayName, int parameterCount) {
        this.index = index;
        this.displayName = displayName;
        this.parameterCount = parameterCount;
    }

    public int getIndex() {
        return index;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Whether a list of {@code count} shape parameters fits this kind. Categorical accepts any
     * count, an empty list standing for its default weights.
     */
    public boolean acceptsParameterCount(int count) {
        return parameterCount < 0 ? count >= 0 : count == parameterCount;
    }

    public static Optional<DistributionKind> fromIndex(int index) {
        for (DistributionKind kind : values()) {
            if (kind.index == index) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static Optional<DistributionKind> fromDisplayName(String name) {
        for (DistributionKind kind : values()) {
            if (kind.displayName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
