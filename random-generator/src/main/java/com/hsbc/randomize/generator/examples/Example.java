package com.hsbc.randomize.generator.examples;

import com.hsbc.randomize.InvalidFloatingRangeResult;
import com.hsbc.randomize.InvalidIntegralRangeResult;
import com.hsbc.randomize.RandomizeOptions;
import com.hsbc.randomize.generator.RandomNumberGenerator;

import java.util.Arrays;

/**
 * Example usage of the random number generator on its own.
 */
public class Example {

    public static void main(String[] args) {
        System.out.println("=== Random Generator Examples ===\n");

        // Example 1: Seeding and reset
        seedingExample();

        // Example 2: Bounded draws
        boundedExample();

        // Example 3: Inverted ranges under each policy
        policyExample();
    }

    /**
     * Demonstrates that a seed fixes the sequence and reset replays it.
     */
    private static void seedingExample() {
        System.out.println("1. Seeding:");

        RandomNumberGenerator generator = new RandomNumberGenerator(5489);
        long first = generator.nextUInt();
        System.out.println("   First word for seed 5489: " + first);
        generator.reset();
        System.out.println("   After reset:              " + generator.nextUInt());

        RandomNumberGenerator unseeded = new RandomNumberGenerator();
        System.out.println("   A generator without a seed picked seed " + unseeded.getSeed() + "\n");
    }

    /**
     * Demonstrates draws within ranges of each numeric type.
     */
    private static void boundedExample() {
        System.out.println("2. Bounded Draws:");

        RandomNumberGenerator generator = new RandomNumberGenerator(2024);
        System.out.println("   next(-10, 10):            " + generator.next(-10, 10));
        System.out.println("   nextUIntInclusive(4e9):   " + generator.nextUIntInclusive(4_000_000_000L));
        System.out.printf("   nextDouble(-1.5, 1.5):    %.6f%n", generator.nextDouble(-1.5, 1.5));
        System.out.printf("   nextDouble(full range):   %.6e%n",
                          generator.nextDouble(-Double.MAX_VALUE, Double.MAX_VALUE));
        System.out.println("   nextBool:                 " + generator.nextBool());

        byte[] bytes = new byte[6];
        generator.nextBytes(bytes);
        System.out.println("   nextBytes:                " + Arrays.toString(bytes) + "\n");
    }

    /**
     * Demonstrates how the configured policies resolve a minimum above the maximum.
     */
    private static void policyExample() {
        System.out.println("3. Inverted Range Policies:");

        for (InvalidFloatingRangeResult result : InvalidFloatingRangeResult.values()) {
            RandomNumberGenerator generator = new RandomNumberGenerator(
                11, RandomizeOptions.DEFAULT.withInvalidFloatingRangeResult(result));
            try {
                System.out.printf("   nextDouble(5, 2) with %-9s -> %s%n", result, generator.nextDouble(5.0, 2.0));
            } catch (IllegalArgumentException e) {
                System.out.printf("   nextDouble(5, 2) with %-9s -> %s%n", result, e.getMessage());
            }
        }
        for (InvalidIntegralRangeResult result : InvalidIntegralRangeResult.values()) {
            RandomNumberGenerator generator = new RandomNumberGenerator(
                11, RandomizeOptions.DEFAULT.withInvalidIntegralRangeResult(result));
            try {
                System.out.printf("   next(5, 2) with %-9s -> %d%n", result, generator.next(5, 2));
            } catch (IllegalArgumentException e) {
                System.out.printf("   next(5, 2) with %-9s -> %s%n", result, e.getMessage());
            }
        }

        System.out.println("\n=== Examples Complete ===");
    }
}
