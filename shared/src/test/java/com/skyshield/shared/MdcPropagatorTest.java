package com.skyshield.shared;

import com.skyshield.shared.util.MdcPropagator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class MdcPropagatorTest {

    @AfterEach
    void tearDown() {
        MdcPropagator.clear();
    }

    @Test
    void test_cycle_scope_sets_and_clears_cycle_id() {
        try (MdcPropagator.Scope ignored = MdcPropagator.openCycle()) {
            assertNotNull(MdcPropagator.currentCycleId());
            assertEquals(8, MdcPropagator.currentCycleId().length());
        }
        assertNull(MdcPropagator.currentCycleId());
    }

    @Test
    void test_track_scope_restores_previous_value() {
        try (MdcPropagator.Scope outer = MdcPropagator.forTrack("outer")) {
            try (MdcPropagator.Scope inner = MdcPropagator.forTrack("inner")) {
                assertEquals("inner", MDC.get(MdcPropagator.TRACK_REF_KEY));
            }
            assertEquals("outer", MDC.get(MdcPropagator.TRACK_REF_KEY));
        }
        assertNull(MDC.get(MdcPropagator.TRACK_REF_KEY));
    }

    @Test
    void test_null_value_removes_key_for_scope() {
        MDC.put(MdcPropagator.TRACK_REF_KEY, "kept");
        try (MdcPropagator.Scope ignored = MdcPropagator.put(MdcPropagator.TRACK_REF_KEY, null)) {
            assertNull(MDC.get(MdcPropagator.TRACK_REF_KEY));
        }
        assertEquals("kept", MDC.get(MdcPropagator.TRACK_REF_KEY));
    }

    @Test
    void test_cycle_ids_are_distinct() {
        String first;
        try (MdcPropagator.Scope ignored = MdcPropagator.openCycle()) {
            first = MdcPropagator.currentCycleId();
        }
        try (MdcPropagator.Scope ignored = MdcPropagator.openCycle()) {
            assertNotEquals(first, MdcPropagator.currentCycleId());
        }
    }
}
