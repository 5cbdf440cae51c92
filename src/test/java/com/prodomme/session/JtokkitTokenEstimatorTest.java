package com.prodomme.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JtokkitTokenEstimatorTest {

    private final JtokkitTokenEstimator estimator = new JtokkitTokenEstimator();

    @Test
    void emptyTextHasNoTokens() {
        assertEquals(0, estimator.countTokens(""));
        assertEquals(0, estimator.countTokens(null));
    }

    @Test
    void countGrowsWithText() {
        int one = estimator.countTokens("hello world");
        int two = estimator.countTokens("hello world hello world");
        assertTrue(one > 0);
        assertTrue(two > one);
    }
}
