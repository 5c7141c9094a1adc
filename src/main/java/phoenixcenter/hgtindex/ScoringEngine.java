package phoenixcenter.hgtindex;

import lombok.extern.log4j.Log4j2;
import phoenixcenter.hgtindex.entity.Category;
import phoenixcenter.hgtindex.entity.HGTScore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns the evidence of one query into hU, AI, the winning category and its consensus hit support.
 */
@Log4j2
public class ScoringEngine {

    /** added to e-values before log10 so that 0 stays finite */
    public static final double EVALUE_OFFSET = 1e-200;

    public static final double DEFAULT_BEST_EVALUE = 1.0;

    public static final double DEFAULT_BEST_BITSCORE = 0.0;

    private final LineageClassifier classifier;

    private final int thresholdId;

    public ScoringEngine(LineageClassifier classifier, int thresholdId) {
        this.classifier = classifier;
        this.thresholdId = thresholdId;
    }

    public HGTScore score(String queryId, QueryEvidence evidence) {
        double ingroupBestEvalue = DEFAULT_BEST_EVALUE;
        double outgroupBestEvalue = DEFAULT_BEST_EVALUE;
        double ingroupBestBitscore = DEFAULT_BEST_BITSCORE;
        double outgroupBestBitscore = DEFAULT_BEST_BITSCORE;
        double ingroupBitscoreSum = 0.0;
        double outgroupBitscoreSum = 0.0;
        int ingroupTaxa = 0;
        int outgroupTaxa = 0;
        Integer winningTaxon = null;
        double winningTaxonSum = Double.NEGATIVE_INFINITY;

        // taxa come in ascending id order, so ties on the sum keep the lowest id
        for (int taxonId : evidence.taxa()) {
            List<Double> bitscores = evidence.bitscores(taxonId);
            double minEvalue = evidence.evalues(taxonId).stream().mapToDouble(Double::doubleValue).min()
                    .orElse(DEFAULT_BEST_EVALUE);
            double maxBitscore = bitscores.stream().mapToDouble(Double::doubleValue).max()
                    .orElse(DEFAULT_BEST_BITSCORE);
            double bitscoreSum = bitscores.stream().mapToDouble(Double::doubleValue).sum();

            Category category = classifier.classify(taxonId, thresholdId);
            if (category == Category.INGROUP) {
                ingroupTaxa++;
                ingroupBestEvalue = Math.min(ingroupBestEvalue, minEvalue);
                ingroupBestBitscore = Math.max(ingroupBestBitscore, maxBitscore);
                ingroupBitscoreSum += bitscoreSum;
            } else if (category == Category.OUTGROUP) {
                outgroupTaxa++;
                outgroupBestEvalue = Math.min(outgroupBestEvalue, minEvalue);
                outgroupBestBitscore = Math.max(outgroupBestBitscore, maxBitscore);
                outgroupBitscoreSum += bitscoreSum;
            } else {
                log.warn("[{}] taxid {} is unassigned and should not have been aggregated", queryId, taxonId);
            }
            if (bitscoreSum > winningTaxonSum) {
                winningTaxonSum = bitscoreSum;
                winningTaxon = taxonId;
            }
        }

        double hU = outgroupBestBitscore - ingroupBestBitscore;
        double ai = Math.log10(ingroupBestEvalue + EVALUE_OFFSET) - Math.log10(outgroupBestEvalue + EVALUE_OFFSET);
        // equal sums go to OUTGROUP
        Category winningCategory = ingroupBitscoreSum > outgroupBitscoreSum ? Category.INGROUP : Category.OUTGROUP;
        int taxonCount = evidence.taxa().size();
        Double support = null;
        if (!evidence.isEmpty()) {
            int agreeing = winningCategory == Category.INGROUP ? ingroupTaxa : outgroupTaxa;
            support = 100.0 * agreeing / taxonCount;
        }
        String lineage = String.join(";", LineageClassifier.UNDEF, LineageClassifier.UNDEF, LineageClassifier.UNDEF);
        if (winningTaxon != null) {
            try {
                lineage = classifier.lineageToHighRank(winningTaxon);
            } catch (MalformedTaxonomyException e) {
                // classification stopped below the break, the lineage walk did not
                log.warn("[{}] {}", queryId, e.getMessage());
            }
        }

        log.debug("[{}] {} hits, bitscore sum INGROUP {} OUTGROUP {}, decision {} (support {}), AI {}",
                queryId, evidence.hitCount(), ingroupBitscoreSum, outgroupBitscoreSum, winningCategory, support, ai);
        return HGTScore.builder()
                .queryId(queryId)
                .hgtIndex(hU)
                .alienIndex(ai)
                .ingroupBestBitscore(ingroupBestBitscore)
                .outgroupBestBitscore(outgroupBestBitscore)
                .ingroupBestEvalue(ingroupBestEvalue)
                .outgroupBestEvalue(outgroupBestEvalue)
                .ingroupBitscoreSum(ingroupBitscoreSum)
                .outgroupBitscoreSum(outgroupBitscoreSum)
                .winningCategory(winningCategory)
                .winningTaxon(winningTaxon)
                .support(support)
                .taxonCount(taxonCount)
                .lineage(lineage)
                .build();
    }

    /**
     * Score every query. Queries are independent, so this runs on a parallel stream.
     *
     * @return scores in natural query id order
     */
    public List<HGTScore> scoreAll(Map<String, QueryEvidence> query2Evidence) {
        return query2Evidence.entrySet().parallelStream()
                .map(e -> score(e.getKey(), e.getValue()))
                .sorted(Comparator.comparing(HGTScore::getQueryId, NaturalOrderComparator.INSTANCE))
                .collect(Collectors.toList());
    }
}
