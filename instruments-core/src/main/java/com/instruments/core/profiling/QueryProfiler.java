package com.instruments.core.profiling;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summarizes timed CQL queries collected during a request: total time spent,
 * the most frequently issued statements and the slowest executions.
 */
public final class QueryProfiler {

    static final int TOP_N = 5;

    private QueryProfiler() {
        throw new AssertionError("No instances");
    }

    public static QueryProfile summarize(List<ProfiledQuery> queries) {
        long totalTime = 0;
        Map<String, Integer> usage = new LinkedHashMap<>();
        List<ProfiledQuery> byTime = new ArrayList<>(queries.size());

        for (ProfiledQuery query : queries) {
            totalTime += query.elapsedMillis();
            usage.merge(query.query(), 1, Integer::sum);
            byTime.add(query);
        }

        List<QueryUsage> topUsed = new ArrayList<>();
        usage.forEach((query, used) -> topUsed.add(new QueryUsage(query, used)));
        topUsed.sort(Comparator.comparingInt(QueryUsage::used).reversed());

        byTime.sort(Comparator.comparingLong(ProfiledQuery::elapsedMillis));
        List<ProfiledQuery> slowest = byTime.subList(Math.max(0, byTime.size() - TOP_N), byTime.size());

        return new QueryProfile(
                totalTime,
                topUsed.subList(0, Math.min(TOP_N, topUsed.size())),
                slowest);
    }

    /**
     * Classifies a CQL statement by its leading keyword.
     *
     * @return one of {@code use_keyspace}, {@code select}, {@code update},
     *         {@code delete}, {@code batch}, {@code unknown}
     */
    public static String queryType(String query) {
        if (query.startsWith("USE")) {
            return "use_keyspace";
        } else if (query.startsWith("SELECT")) {
            return "select";
        } else if (query.startsWith("UPDATE")) {
            return "update";
        } else if (query.startsWith("DELETE")) {
            return "delete";
        } else if (query.contains("BATCH")) {
            return "batch";
        }
        return "unknown";
    }
}
