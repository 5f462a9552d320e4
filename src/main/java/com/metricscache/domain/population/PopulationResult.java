package com.metricscache.domain.population;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a population run.
 *
 * {@code nextOffset} is the offset to pass back in to resume: request offset
 * plus {@code written}. Only whole batches count as written.
 */
@Value
@Builder
public class PopulationResult {

    long written;
    long nextOffset;
    long elapsedMs;
    PopulationStatus status;
    String errorMessage;

    public boolean isSuccess() {
        return status == PopulationStatus.COMPLETED;
    }

    @Override
    public String toString() {
        return String.format("[population] written=%d, nextOffset=%d, cost=%dms, status=%s%s",
                written,
                nextOffset,
                elapsedMs,
                status,
                errorMessage != null ? ", error=" + errorMessage : "");
    }
}
