package phoenixcenter.hgtindex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * Bitscores and e-values of one query, grouped by hit taxon. Taxa iterate in ascending id order.
 * Only {@link HitAggregator} appends; everything else reads.
 */
public class QueryEvidence {

    private final String queryId;

    private final TreeMap<Integer, TaxonHits> tid2Hits = new TreeMap<>();

    QueryEvidence(String queryId) {
        this.queryId = queryId;
    }

    void add(int taxonId, double bitscore, double evalue) {
        TaxonHits hits = tid2Hits.get(taxonId);
        if (hits == null) {
            hits = new TaxonHits();
            tid2Hits.put(taxonId, hits);
        }
        hits.bitscores.add(bitscore);
        hits.evalues.add(evalue);
    }

    public String getQueryId() {
        return queryId;
    }

    public Set<Integer> taxa() {
        return Collections.unmodifiableSet(tid2Hits.keySet());
    }

    public List<Double> bitscores(int taxonId) {
        TaxonHits hits = tid2Hits.get(taxonId);
        return hits == null ? Collections.emptyList() : Collections.unmodifiableList(hits.bitscores);
    }

    public List<Double> evalues(int taxonId) {
        TaxonHits hits = tid2Hits.get(taxonId);
        return hits == null ? Collections.emptyList() : Collections.unmodifiableList(hits.evalues);
    }

    public int hitCount() {
        return tid2Hits.values().stream().mapToInt(h -> h.bitscores.size()).sum();
    }

    public boolean isEmpty() {
        return tid2Hits.isEmpty();
    }

    private static class TaxonHits {

        private final List<Double> bitscores = new ArrayList<>();

        private final List<Double> evalues = new ArrayList<>();
    }
}
