package phoenixcenter.hgtindex;

import phoenixcenter.hgtindex.entity.CandidateDecision;
import phoenixcenter.hgtindex.entity.Category;
import phoenixcenter.hgtindex.entity.HGTScore;
import phoenixcenter.hgtindex.entity.RunSummary;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies the hU (or AI) and support thresholds to scored queries.
 */
public class CandidateSelector {

    private final double hgtIndexThreshold;

    private final double supportThreshold;

    private final boolean useAlienIndex;

    /**
     * @param hgtIndexThreshold minimum hU; also the minimum AI
     * @param useAlienIndex     decide on AI instead of hU
     */
    public CandidateSelector(double hgtIndexThreshold, double supportThreshold, boolean useAlienIndex) {
        this.hgtIndexThreshold = hgtIndexThreshold;
        this.supportThreshold = supportThreshold;
        this.useAlienIndex = useAlienIndex;
    }

    public CandidateDecision decide(HGTScore score) {
        double metric = useAlienIndex ? score.getAlienIndex() : score.getHgtIndex();
        boolean candidate = metric >= hgtIndexThreshold
                && score.getWinningCategory() == Category.OUTGROUP
                && isSupported(score);
        return new CandidateDecision(candidate, score);
    }

    public List<CandidateDecision> decideAll(List<HGTScore> scores) {
        return scores.stream().map(this::decide).collect(Collectors.toList());
    }

    /**
     * Undefined support never passes.
     */
    public boolean isSupported(HGTScore score) {
        // full precision, the two decimal form is for display only
        return score.isSupportDefined() && score.getSupport() >= supportThreshold;
    }

    /**
     * Count queries per metric and category. Queries without evidence are counted separately and
     * not attributed to a category.
     */
    public RunSummary summarize(List<CandidateDecision> decisions, AggregationResult aggregation) {
        RunSummary summary = new RunSummary();
        summary.setTotalHits(aggregation.getTotalHits());
        summary.setRetainedHits(aggregation.getRetainedHits());
        summary.getSkippedHits().putAll(aggregation.getSkipCounts());
        for (CandidateDecision decision : decisions) {
            HGTScore score = decision.getScore();
            summary.setQueries(summary.getQueries() + 1);
            if (score.getHgtIndex() >= hgtIndexThreshold) {
                summary.setHgtIndexSupported(summary.getHgtIndexSupported() + 1);
            }
            if (score.getAlienIndex() >= hgtIndexThreshold) {
                summary.setAlienIndexSupported(summary.getAlienIndexSupported() + 1);
            }
            if (decision.isCandidate()) {
                summary.setCandidates(summary.getCandidates() + 1);
            }
            if (!score.hasEvidence()) {
                summary.setQueriesWithoutEvidence(summary.getQueriesWithoutEvidence() + 1);
            } else if (score.getWinningCategory() == Category.INGROUP) {
                summary.setIngroup(summary.getIngroup() + 1);
                if (isSupported(score)) {
                    summary.setIngroupSupported(summary.getIngroupSupported() + 1);
                }
            } else {
                summary.setOutgroup(summary.getOutgroup() + 1);
                if (isSupported(score)) {
                    summary.setOutgroupSupported(summary.getOutgroupSupported() + 1);
                }
            }
        }
        return summary;
    }
}
