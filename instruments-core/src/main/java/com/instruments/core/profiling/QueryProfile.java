package com.instruments.core.profiling;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Summary of a batch of profiled queries, serialized as
 * {@code {"stats": {"total_time": ...}, "queries": {"top_5_used": [...], "top_5_time": [...]}}}.
 */
@JsonPropertyOrder({"stats", "queries"})
public record QueryProfile(
        @JsonProperty("stats") Stats stats,
        @JsonProperty("queries") Queries queries
) {

    public QueryProfile(long totalTimeMillis, List<QueryUsage> topUsed, List<ProfiledQuery> topTime) {
        this(new Stats(totalTimeMillis), new Queries(topUsed, topTime));
    }

    /**
     * @param totalTimeMillis sum of all query times
     */
    public record Stats(@JsonProperty("total_time") long totalTimeMillis) {
    }

    /**
     * @param topUsed the most frequent queries, most used first
     * @param topTime the slowest executions, fastest of them first
     */
    @JsonPropertyOrder({"top_5_used", "top_5_time"})
    public record Queries(
            @JsonProperty("top_5_used") List<QueryUsage> topUsed,
            @JsonProperty("top_5_time") List<ProfiledQuery> topTime
    ) {
        public Queries {
            topUsed = List.copyOf(topUsed);
            topTime = List.copyOf(topTime);
        }
    }

    public long totalTimeMillis() {
        return stats.totalTimeMillis();
    }

    public List<QueryUsage> topUsed() {
        return queries.topUsed();
    }

    public List<ProfiledQuery> topTime() {
        return queries.topTime();
    }
}
