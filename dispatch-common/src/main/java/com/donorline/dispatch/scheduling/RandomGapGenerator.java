package com.donorline.dispatch.scheduling;

import java.util.random.RandomGenerator;

/**
 * Uniform gap in {@code [min, max]} minutes, both ends included.
 */
public class RandomGapGenerator implements GapGenerator {

    private final RandomGenerator random;

    public RandomGapGenerator() {
        this(RandomGenerator.getDefault());
    }

    public RandomGapGenerator(RandomGenerator random) {
        this.random = random;
    }

    @Override
    public int nextGapMinutes(int minMinutes, int maxMinutes) {
        if (minMinutes >= maxMinutes) {
            return minMinutes;
        }
        return random.nextInt(minMinutes, maxMinutes + 1);
    }
}
