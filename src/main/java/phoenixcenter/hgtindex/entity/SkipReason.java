package phoenixcenter.hgtindex.entity;

public enum SkipReason {

    INVALID_TAXID("invalid/unrecognised taxid"),

    UNKNOWN_PARENT("invalid/unrecognised parent taxid"),

    SKIPPED_TAXON("taxid within skipped clade"),

    UNASSIGNED("taxid unassigned/unclassified"),

    MALFORMED_RECORD("missing query id, or invalid evalue or bitscore"),

    MALFORMED_TAXONOMY("lineage cannot be resolved to the root");

    private final String description;

    SkipReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
