package com.donorline.dispatch.scheduling;

/**
 * Source of the spacing between two consecutive sends.
 */
@FunctionalInterface
public interface GapGenerator {

    /**
     * @return a gap in minutes within {@code [minMinutes, maxMinutes]}
     */
    int nextGapMinutes(int minMinutes, int maxMinutes);
}
