package phoenixcenter.hgtindex;

import lombok.extern.log4j.Log4j2;
import phoenixcenter.hgtindex.entity.TaxonNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Read-only view of the taxonomy: parent, rank and scientific name per taxon id.
 * <p>
 * Merged (old to new) ids are stored in the parent table, so an old id resolves as a direct
 * child of its replacement.
 */
@Log4j2
public class TaxonomyStore {

    private final Map<Integer, Integer> tid2Parent;

    private final Map<Integer, String> tid2Rank;

    private final Map<Integer, String> tid2Name;

    private TaxonomyStore(Map<Integer, Integer> tid2Parent,
                          Map<Integer, String> tid2Rank,
                          Map<Integer, String> tid2Name) {
        this.tid2Parent = Collections.unmodifiableMap(tid2Parent);
        this.tid2Rank = Collections.unmodifiableMap(tid2Rank);
        this.tid2Name = Collections.unmodifiableMap(tid2Name);
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptionalInt parentOf(int taxonId) {
        Integer parent = tid2Parent.get(taxonId);
        return parent == null ? OptionalInt.empty() : OptionalInt.of(parent);
    }

    public Optional<String> rankOf(int taxonId) {
        return Optional.ofNullable(tid2Rank.get(taxonId));
    }

    public Optional<String> nameOf(int taxonId) {
        return Optional.ofNullable(tid2Name.get(taxonId));
    }

    public boolean contains(int taxonId) {
        return tid2Parent.containsKey(taxonId);
    }

    /**
     * @return the number of ids with a parent, redirected ids included
     */
    public int size() {
        return tid2Parent.size();
    }

    public Optional<TaxonNode> node(int taxonId) {
        Integer parent = tid2Parent.get(taxonId);
        if (parent == null) {
            return Optional.empty();
        }
        return Optional.of(new TaxonNode(taxonId, parent, tid2Rank.get(taxonId), tid2Name.get(taxonId)));
    }

    public static class Builder {

        private final Map<Integer, Integer> tid2Parent = new HashMap<>();

        private final Map<Integer, String> tid2Rank = new HashMap<>();

        private final Map<Integer, String> tid2Name = new HashMap<>();

        private final Map<Integer, Integer> redirects = new HashMap<>();

        private Builder() {
        }

        /**
         * Add a node. Null rank or name leave any previous value in place.
         */
        public Builder addNode(TaxonNode node) {
            if (node.getId() == null || node.getParentId() == null) {
                throw new IllegalArgumentException("Taxon node needs an id and a parent id: " + node);
            }
            tid2Parent.put(node.getId(), node.getParentId());
            if (node.getRank() != null) {
                tid2Rank.put(node.getId(), node.getRank());
            }
            if (node.getName() != null) {
                tid2Name.put(node.getId(), node.getName());
            }
            return this;
        }

        public Builder addName(int taxonId, String name) {
            tid2Name.put(taxonId, name);
            return this;
        }

        public Builder addRedirect(int oldTaxonId, int newTaxonId) {
            redirects.put(oldTaxonId, newTaxonId);
            return this;
        }

        /**
         * Apply redirects and freeze. A redirect whose target has no parent entry is dropped.
         */
        public TaxonomyStore build() {
            Map<Integer, Integer> parents = new HashMap<>(tid2Parent);
            int dropped = 0;
            for (Map.Entry<Integer, Integer> e : redirects.entrySet()) {
                if (tid2Parent.containsKey(e.getValue())) {
                    parents.put(e.getKey(), e.getValue());
                } else {
                    dropped++;
                    log.debug("redirect {} -> {} dropped, target not in taxonomy", e.getKey(), e.getValue());
                }
            }
            if (dropped > 0) {
                log.warn("{} merged taxids point to unknown taxids and were ignored", dropped);
            }
            return new TaxonomyStore(parents, new HashMap<>(tid2Rank), new HashMap<>(tid2Name));
        }
    }
}
