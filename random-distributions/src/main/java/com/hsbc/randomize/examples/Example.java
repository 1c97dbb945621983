package com.hsbc.randomize.examples;

import com.hsbc.randomize.InvalidFloatingRangeResult;
import com.hsbc.randomize.RandomizeOptions;
import com.hsbc.randomize.distributions.CategoricalDistribution;
import com.hsbc.randomize.distributions.DistributionProperties;
import com.hsbc.randomize.distributions.NormalDistribution;
import com.hsbc.randomize.generator.RandomNumberGenerator;
import com.hsbc.randomize.parameters.DistributionParameters;
import com.hsbc.randomize.parameters.ParameterCodec;
import com.hsbc.randomize.parameters.ParameterizedDistribution;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Example usage of the generator, the distribution samplers and the parameter text forms.
 */
public class Example {

    public static void main(String[] args) {
        System.out.println("=== Randomize Examples ===\n");

        // Example 1: Seeded uniform values
        uniformExample();

        // Example 2: Weighted categories
        categoricalExample();

        // Example 3: Truncated normal samples
        normalExample();

        // Example 4: Parameters as text
        parametersExample();
    }

    /**
     * Demonstrates that a seeded generator is reproducible.
     */
    private static void uniformExample() {
        System.out.println("1. Seeded Uniform Values:");

        RandomNumberGenerator first = new RandomNumberGenerator(5489);
        RandomNumberGenerator second = new RandomNumberGenerator(5489);

        System.out.print("   Dice rolls (seed 5489): ");
        for (int i = 0; i < 10; i++) {
            System.out.print(first.nextInclusive(1, 6) + " ");
        }
        System.out.print("\n   Same seed again:        ");
        for (int i = 0; i < 10; i++) {
            System.out.print(second.nextInclusive(1, 6) + " ");
        }
        System.out.println("\n");
    }

    /**
     * Demonstrates drawing weighted categories and checking their frequencies.
     */
    private static void categoricalExample() {
        System.out.println("2. Categorical Distribution:");
        double[] weights = {1, 1, 2};
        System.out.println("   Weights " + Arrays.toString(weights) + " normalize to "
                           + Arrays.toString(CategoricalDistribution.normalize(weights)));

        RandomNumberGenerator generator = new RandomNumberGenerator(123);
        int totalSamples = 100000;
        int[] counts = new int[weights.length];
        CategoricalDistribution.samples(generator, totalSamples, weights).forEach(index -> counts[index]++);

        for (int i = 0; i < counts.length; i++) {
            System.out.printf("   Category %d: %d occurrences (%.1f%%)%n", i, counts[i], 100.0 * counts[i] / totalSamples);
        }
        System.out.println();
    }

    /**
     * Demonstrates bounded normal sampling and the effect of a range policy.
     */
    private static void normalExample() {
        System.out.println("3. Truncated Normal Distribution:");

        DistributionProperties properties = NormalDistribution.getProperties(5, 2);
        System.out.println("   Mean " + properties.getMean() + ", variance " + properties.getVariance());

        RandomNumberGenerator generator = new RandomNumberGenerator(7);
        String samples = NormalDistribution.samples(generator, 8, 5, 2, 4.0, 6.0)
            .mapToObj(value -> String.format("%.3f", value))
            .collect(Collectors.joining(" "));
        System.out.println("   Samples within [4, 6]: " + samples);

        RandomNumberGenerator swapping = new RandomNumberGenerator(
            7, RandomizeOptions.DEFAULT.withInvalidFloatingRangeResult(InvalidFloatingRangeResult.SWAP));
        String swapped = NormalDistribution.samples(swapping, 8, 5, 2, 6.0, 4.0)
            .mapToObj(value -> String.format("%.3f", value))
            .collect(Collectors.joining(" "));
        System.out.println("   Bounds (6, 4) swapped:  " + swapped + "\n");
    }

    /**
     * Demonstrates both text forms and sampling from parsed parameters.
     */
    private static void parametersExample() {
        System.out.println("4. Distribution Parameters:");

        DistributionParameters parameters = DistributionParameters.normal(100, 15, 55.0, 145.0, 1);
        String roundTrip = ParameterCodec.format(parameters, ParameterCodec.ROUND_TRIP);
        System.out.println("   General:    " + ParameterCodec.format(parameters, ParameterCodec.GENERAL, Locale.US));
        System.out.println("   Round-trip: " + roundTrip);

        DistributionParameters parsed = ParameterCodec.parse(roundTrip);
        System.out.println("   Parsed back equals input: " + parsed.equals(parameters));

        String samples = ParameterizedDistribution.samples(new RandomNumberGenerator(42), 6, parsed)
            .mapToObj(Double::toString)
            .collect(Collectors.joining(" "));
        System.out.println("   Samples: " + samples);

        System.out.println("\n=== Examples Complete ===");
    }
}
