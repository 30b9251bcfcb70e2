package com.skyshield.evaluator.gateway;

import com.skyshield.evaluator.exception.StoreConnectionException;

/**
 * Boundary between the evaluator and whatever technology stores the tracks.
 */
public interface TrackStoreGateway {

    /**
     * Checks that the store can be reached.
     *
     * @throws StoreConnectionException if it cannot
     */
    void verifyConnectivity();

    /**
     * Opens a scoped session for one cycle. Callers must close it.
     *
     * @throws StoreConnectionException if no connection can be obtained
     */
    TrackStoreSession openSession();
}
