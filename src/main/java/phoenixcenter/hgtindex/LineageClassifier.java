package phoenixcenter.hgtindex;

import phoenixcenter.hgtindex.entity.Category;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Ancestor walks over a {@link TaxonomyStore}.
 * <p>
 * Walks start at the parent of the queried taxon and are bounded by the number of taxa in the
 * store, so cyclic or broken data fails with {@link MalformedTaxonomyException} instead of looping.
 */
public class LineageClassifier {

    public static final int ROOT_ID = 1;

    /** "unidentified" */
    public static final int UNIDENTIFIED_ID = 32644;

    /** "unclassified sequences" */
    public static final int UNCLASSIFIED_SEQUENCES_ID = 12908;

    public static final String UNDEF = "undef";

    private static final List<String> HIGH_RANKS = Arrays.asList("superkingdom", "kingdom", "phylum");

    private static final List<String> SPECIES_RANKS = Arrays.asList("superkingdom", "kingdom", "phylum",
            "class", "order", "family", "genus", "species");

    private final TaxonomyStore store;

    private final int maxSteps;

    public LineageClassifier(TaxonomyStore store) {
        this.store = store;
        this.maxSteps = store.size() + 1;
    }

    public TaxonomyStore getStore() {
        return store;
    }

    /**
     * Place a taxon relative to the threshold clade.
     *
     * @return UNASSIGNED when the taxon has no parent or descends from an unidentified or
     * unclassified node, INGROUP when the threshold is met first, OUTGROUP when the root is
     * met first
     * @throws MalformedTaxonomyException if an ancestor has no parent or the root is never reached
     */
    public Category classify(int taxonId, int thresholdId) {
        OptionalInt first = store.parentOf(taxonId);
        if (!first.isPresent()) {
            return Category.UNASSIGNED;
        }
        int parent = first.getAsInt();
        for (int step = 0; step < maxSteps; step++) {
            if (parent == thresholdId) {
                return Category.INGROUP;
            } else if (parent == ROOT_ID) {
                return Category.OUTGROUP;
            } else if (parent == UNIDENTIFIED_ID || parent == UNCLASSIFIED_SEQUENCES_ID) {
                return Category.UNASSIGNED;
            }
            parent = parentOrFail(parent, taxonId);
        }
        throw new MalformedTaxonomyException(taxonId, "root not reached within " + maxSteps + " steps");
    }

    /**
     * @return true if the clade is an ancestor of the taxon
     */
    public boolean isWithin(int taxonId, int cladeId) {
        return classify(taxonId, cladeId) == Category.INGROUP;
    }

    /**
     * @return "superkingdom;kingdom;phylum" with whitespace replaced by underscores
     */
    public String lineageToHighRank(int taxonId) {
        return lineage(taxonId, HIGH_RANKS);
    }

    /**
     * @return "superkingdom;kingdom;phylum;class;order;family;genus;species"
     */
    public String lineageToSpecies(int taxonId) {
        return lineage(taxonId, SPECIES_RANKS);
    }

    private String lineage(int taxonId, List<String> ranks) {
        Map<String, String> rank2Name = new HashMap<>();
        OptionalInt first = store.parentOf(taxonId);
        int parent = first.orElse(ROOT_ID);
        boolean done = !first.isPresent();
        for (int step = 0; !done; step++) {
            if (step >= maxSteps) {
                throw new MalformedTaxonomyException(taxonId, "root not reached within " + maxSteps + " steps");
            }
            String rank = normalizeRank(store.rankOf(parent).orElse(""));
            if (ranks.contains(rank)) {
                rank2Name.putIfAbsent(rank, store.nameOf(parent).orElse(UNDEF));
            }
            if ("superkingdom".equals(rank) || parent == ROOT_ID) {
                done = true;
            } else {
                parent = parentOrFail(parent, taxonId);
            }
        }
        return ranks.stream()
                .map(r -> rank2Name.getOrDefault(r, UNDEF))
                .collect(Collectors.joining(";"))
                .replaceAll("\\s+", "_");
    }

    /**
     * NCBI renamed superkingdom to domain in 2025 dumps.
     */
    private static String normalizeRank(String rank) {
        return "domain".equals(rank) ? "superkingdom" : rank;
    }

    private int parentOrFail(int current, int walkedFrom) {
        OptionalInt next = store.parentOf(current);
        if (!next.isPresent()) {
            throw new MalformedTaxonomyException(walkedFrom, "ancestor " + current + " has no parent");
        }
        return next.getAsInt();
    }
}
