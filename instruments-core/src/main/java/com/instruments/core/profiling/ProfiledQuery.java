package com.instruments.core.profiling;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.instruments.api.Work;

/**
 * A query string and the work that timed its execution.
 */
public record ProfiledQuery(
        @JsonProperty("query") String query,
        @JsonIgnore Work work
) {
    /**
     * @return stop minus start in milliseconds, 0 if the work has not finished
     */
    @JsonProperty("time")
    public long elapsedMillis() {
        if (work.startTime().isEmpty() || work.stopTime().isEmpty()) {
            return 0L;
        }
        return work.stopTime().getAsLong() - work.startTime().getAsLong();
    }
}
