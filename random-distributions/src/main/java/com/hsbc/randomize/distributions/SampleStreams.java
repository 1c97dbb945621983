package com.hsbc.randomize.distributions;

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.DoubleSupplier;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;
import java.util.stream.LongStream;
import java.util.stream.StreamSupport;

/**
 * Builds the lazy, sized, single-pass streams returned by the samplers. The supplier is invoked
 * once per element, only as the stream is consumed.
 */
public final class SampleStreams {

    private static final int CHARACTERISTICS = Spliterator.ORDERED | Spliterator.NONNULL;

    private SampleStreams() {
    }

    static DoubleStream doubles(int count, DoubleSupplier supplier) {
        final int size = Math.max(0, count);
        PrimitiveIterator.OfDouble iterator = new PrimitiveIterator.OfDouble() {
            private int remaining = size;

            @Override
            public boolean hasNext() {
                return remaining > 0;
            }

            @Override
            public double nextDouble() {
                if (remaining <= 0) {
                    throw new NoSuchElementException();
                }
                remaining--;
                return supplier.getAsDouble();
            }
        };
        return StreamSupport.doubleStream(Spliterators.spliterator(iterator, size, CHARACTERISTICS), false);
    }

    static IntStream ints(int count, IntSupplier supplier) {
        final int size = Math.max(0, count);
        PrimitiveIterator.OfInt iterator = new PrimitiveIterator.OfInt() {
            private int remaining = size;

            @Override
            public boolean hasNext() {
                return remaining > 0;
            }

            @Override
            public int nextInt() {
                if (remaining <= 0) {
                    throw new NoSuchElementException();
                }
                remaining--;
                return supplier.getAsInt();
            }
        };
        return StreamSupport.intStream(Spliterators.spliterator(iterator, size, CHARACTERISTICS), false);
    }

    static LongStream longs(int count, LongSupplier supplier) {
        final int size = Math.max(0, count);
        PrimitiveIterator.OfLong iterator = new PrimitiveIterator.OfLong() {
            private int remaining = size;

            @Override
            public boolean hasNext() {
                return remaining > 0;
            }

            @Override
            public long nextLong() {
                if (remaining <= 0) {
                    throw new NoSuchElementException();
                }
                remaining--;
                return supplier.getAsLong();
            }
        };
        return StreamSupport.longStream(Spliterators.spliterator(iterator, size, CHARACTERISTICS), false);
    }

    /**
     * A stream repeating one value, for degenerate distributions. Draws nothing from any
     * generator.
     */
    public static DoubleStream constant(int count, double value) {
        return doubles(count, () -> value);
    }
}
