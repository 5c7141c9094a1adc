package phoenixcenter.hgtindex.entity;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Run-level counters, filled once after scoring.
 */
@Data
@NoArgsConstructor
public class RunSummary {

    private long totalHits;

    private long retainedHits;

    private Map<SkipReason, Long> skippedHits = new EnumMap<>(SkipReason.class);

    private long queries;

    private long queriesWithoutEvidence;

    private long hgtIndexSupported;

    private long alienIndexSupported;

    private long ingroup;

    private long ingroupSupported;

    private long outgroup;

    private long outgroupSupported;

    private long candidates;

    public long getSkipped(SkipReason reason) {
        return skippedHits.getOrDefault(reason, 0L);
    }
}
