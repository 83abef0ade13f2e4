package com.instruments.core.profiling;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QueryUsage(
        @JsonProperty("query") String query,
        @JsonProperty("used") int used
) {
}
