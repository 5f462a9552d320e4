package com.metricscache.domain.population;

/**
 * Why a population run stopped.
 */
public enum PopulationStatus {

    /**
     * Every target was written.
     */
    COMPLETED,

    /**
     * A batch failed at the transport level; remaining batches were not attempted.
     */
    FAILED,

    /**
     * The running thread was interrupted between batches.
     */
    INTERRUPTED
}
