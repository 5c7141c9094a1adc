package phoenixcenter.hgtindex;

/**
 * Thrown when an ancestor walk meets a taxon without parent or does not reach the root.
 */
public class MalformedTaxonomyException extends RuntimeException {

    private final int taxonId;

    public MalformedTaxonomyException(int taxonId, String message) {
        super("Malformed lineage for taxid " + taxonId + ": " + message);
        this.taxonId = taxonId;
    }

    public int getTaxonId() {
        return taxonId;
    }
}
