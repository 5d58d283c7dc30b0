package com.propplatform.common.scoring;

/**
 * The single canonical transform between the two sides of one line.
 *
 * <p>Every complementary confidence in the platform is derived here, never
 * re-derived from individual evaluators, so that
 * {@code confidence(side) + confidence(opposite) == 100} always holds.
 */
public final class SideTransform {

    private SideTransform() {}

    public static int complement(int confidence) {
        return 100 - confidence;
    }
}
