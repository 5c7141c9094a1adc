package phoenixcenter.hgtindex;

import lombok.extern.log4j.Log4j2;
import phoenixcenter.hgtindex.entity.Category;
import phoenixcenter.hgtindex.entity.Hit;
import phoenixcenter.hgtindex.entity.SkipReason;
import phoenixcenter.hgtindex.entity.SkippedHit;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Filters hits and collects bitscores and e-values per query and taxon.
 * <p>
 * Not thread safe: feed it from one thread, then call {@link #finish()} once.
 */
@Log4j2
public class HitAggregator {

    private static final Pattern TAXID = Pattern.compile("\\d+");

    private final LineageClassifier classifier;

    private final TaxonomyStore store;

    private final int thresholdId;

    private final int skipId;

    private final Consumer<SkippedHit> skipConsumer;

    private final Map<String, QueryEvidence> query2Evidence = new HashMap<>();

    private final Map<SkipReason, Long> skipCounts = new EnumMap<>(SkipReason.class);

    private long totalHits = 0L;

    private long retainedHits = 0L;

    private boolean finished = false;

    /**
     * @param skipId       hits within this clade are dropped; 0 or less disables the filter
     * @param skipConsumer receives every rejected hit, may be null
     */
    public HitAggregator(LineageClassifier classifier,
                         int thresholdId,
                         int skipId,
                         Consumer<SkippedHit> skipConsumer) {
        this.classifier = classifier;
        this.store = classifier.getStore();
        this.thresholdId = thresholdId;
        this.skipId = skipId;
        this.skipConsumer = skipConsumer;
    }

    /**
     * Add one hit. The query is registered even when the hit is rejected.
     *
     * @return the rejection reason, empty if the hit was kept
     */
    public Optional<SkipReason> ingest(Hit hit) {
        if (finished) {
            throw new IllegalStateException("Aggregation already finished");
        }
        totalHits += 1L;
        // blank ids come from empty first columns of tab separated rows
        QueryEvidence evidence = hit.getQueryId() == null || hit.getQueryId().isBlank()
                ? null
                : query2Evidence.computeIfAbsent(hit.getQueryId(), QueryEvidence::new);
        int taxonId = parseTaxonId(hit.getTaxonToken());
        SkipReason reason;
        try {
            reason = evidence == null ? SkipReason.MALFORMED_RECORD : check(hit, taxonId);
        } catch (MalformedTaxonomyException e) {
            log.debug("[{}] hit on taxid {} skipped: {}", hit.getQueryId(), e.getTaxonId(), e.getMessage());
            reason = SkipReason.MALFORMED_TAXONOMY;
        }
        if (reason != null) {
            skipCounts.merge(reason, 1L, Long::sum);
            if (skipConsumer != null) {
                skipConsumer.accept(new SkippedHit(hit.getQueryId(), hit.getLineNumber(), hit.getTaxonToken(), reason));
            }
            return Optional.of(reason);
        }
        evidence.add(taxonId, hit.getBitscore(), hit.getEvalue());
        retainedHits += 1L;
        return Optional.empty();
    }

    private SkipReason check(Hit hit, int taxonId) {
        if (taxonId <= 0) {
            return SkipReason.INVALID_TAXID;
        }
        if (!store.contains(taxonId)) {
            return SkipReason.UNKNOWN_PARENT;
        }
        if (skipId > 0 && classifier.isWithin(taxonId, skipId)) {
            return SkipReason.SKIPPED_TAXON;
        }
        if (classifier.classify(taxonId, thresholdId) == Category.UNASSIGNED) {
            return SkipReason.UNASSIGNED;
        }
        if (!isScore(hit.getBitscore()) || !isScore(hit.getEvalue())) {
            return SkipReason.MALFORMED_RECORD;
        }
        return null;
    }

    /**
     * Stop accepting hits and hand out the evidence.
     */
    public AggregationResult finish() {
        finished = true;
        return new AggregationResult(query2Evidence, skipCounts, totalHits, retainedHits);
    }

    /**
     * @return the taxon id, or -1 if the token is not a positive integer
     */
    static int parseTaxonId(String token) {
        if (token == null) {
            return -1;
        }
        String trimmed = token.trim();
        if (!TAXID.matcher(trimmed).matches()) {
            return -1;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            // too large for a taxid
            return -1;
        }
    }

    private static boolean isScore(double value) {
        return !Double.isNaN(value) && value >= 0;
    }
}
