package com.skyshield.evaluator.unit;

import com.skyshield.evaluator.policy.DeadBandFilter;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DeadBandFilterTest {

    private final DeadBandFilter filter = new DeadBandFilter(2);

    @Test
    void test_difference_equal_to_threshold_is_suppressed() {
        assertFalse(filter.shouldPersist(50, 52));
        assertFalse(filter.shouldPersist(50, 48));
    }

    @Test
    void test_difference_above_threshold_is_written() {
        assertTrue(filter.shouldPersist(50, 53));
        assertTrue(filter.shouldPersist(50, 47));
    }

    @Test
    void test_unchanged_score_is_suppressed() {
        assertFalse(filter.shouldPersist(70, 70));
    }

    @Test
    void test_compares_difference_not_new_value() {
        assertTrue(filter.shouldPersist(0, 3));
        assertFalse(filter.shouldPersist(98, 100));
    }

    @Test
    void test_zero_threshold_writes_any_change() {
        DeadBandFilter exact = new DeadBandFilter(0);
        assertTrue(exact.shouldPersist(50, 51));
        assertFalse(exact.shouldPersist(50, 50));
    }

    @Test
    void test_negative_threshold_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new DeadBandFilter(-1));
    }
}
