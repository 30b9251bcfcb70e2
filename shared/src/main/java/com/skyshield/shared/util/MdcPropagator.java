package com.skyshield.shared.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helpers for SkyShield workers.
 *
 * Every evaluation cycle gets a short cycle id and every track processed in
 * that cycle is tagged with its external reference, so log lines emitted
 * deep inside scoring or persistence can be correlated back to the cycle
 * and track that produced them. Scopes are returned as {@link Scope} so
 * callers restore the previous context with try-with-resources.
 */
public final class MdcPropagator {

    public static final String CYCLE_ID_KEY = "cycleId";
    public static final String TRACK_REF_KEY = "trackRef";
    public static final String SERVICE_KEY = "service";

    private MdcPropagator() {
    }

    /**
     * A piece of diagnostic context that is removed (or restored) on close.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    /**
     * Opens a new cycle scope with a freshly generated cycle id.
     *
     * @return the scope; closing it clears the cycle id
     */
    public static Scope openCycle() {
        return put(CYCLE_ID_KEY, newCycleId());
    }

    /**
     * Tags the current thread with the track being processed.
     *
     * @param trackRef the external reference of the track
     * @return the scope; closing it restores the previous track tag, if any
     */
    public static Scope forTrack(String trackRef) {
        return put(TRACK_REF_KEY, trackRef);
    }

    /**
     * Puts {@code key=value} into the MDC and returns a scope restoring the previous value.
     */
    public static Scope put(String key, String value) {
        String previous = MDC.get(key);
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
        return () -> {
            if (previous != null) {
                MDC.put(key, previous);
            } else {
                MDC.remove(key);
            }
        };
    }

    /**
     * Returns the cycle id of the current thread, or null outside a cycle.
     */
    public static String currentCycleId() {
        return MDC.get(CYCLE_ID_KEY);
    }

    /**
     * Clears all SkyShield keys from the current thread's MDC.
     */
    public static void clear() {
        MDC.remove(CYCLE_ID_KEY);
        MDC.remove(TRACK_REF_KEY);
        MDC.remove(SERVICE_KEY);
    }

    static String newCycleId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
