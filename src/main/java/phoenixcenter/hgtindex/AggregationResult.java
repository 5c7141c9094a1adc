package phoenixcenter.hgtindex;

import phoenixcenter.hgtindex.entity.SkipReason;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Output of {@link HitAggregator#finish()}: evidence per query plus hit counters.
 */
public class AggregationResult {

    private final Map<String, QueryEvidence> query2Evidence;

    private final Map<SkipReason, Long> skipCounts;

    private final long totalHits;

    private final long retainedHits;

    AggregationResult(Map<String, QueryEvidence> query2Evidence,
                      Map<SkipReason, Long> skipCounts,
                      long totalHits,
                      long retainedHits) {
        this.query2Evidence = Collections.unmodifiableMap(query2Evidence);
        this.skipCounts = Collections.unmodifiableMap(new EnumMap<>(skipCounts));
        this.totalHits = totalHits;
        this.retainedHits = retainedHits;
    }

    public Map<String, QueryEvidence> getQuery2Evidence() {
        return query2Evidence;
    }

    public Map<SkipReason, Long> getSkipCounts() {
        return skipCounts;
    }

    public long getSkipCount(SkipReason reason) {
        return skipCounts.getOrDefault(reason, 0L);
    }

    public long getTotalHits() {
        return totalHits;
    }

    public long getRetainedHits() {
        return retainedHits;
    }
}
