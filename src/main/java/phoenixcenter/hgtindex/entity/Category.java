package phoenixcenter.hgtindex.entity;

/**
 * Position of a taxon relative to the ingroup threshold clade.
 */
public enum Category {

    INGROUP,

    OUTGROUP,

    UNASSIGNED;

    /**
     * @return the label used in result tables and hit names
     */
    public String shortLabel() {
        switch (this) {
            case INGROUP:
                return "IN";
            case OUTGROUP:
                return "OUT";
            default:
                return "NA";
        }
    }
}
