package phoenixcenter.hgtindex.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import phoenixcenter.hgtindex.GlobalConfig;

import java.util.regex.Pattern;

/**
 * Settings of one run. Unset builder fields fall back to hgt.properties.
 */
@Data
@AllArgsConstructor
@Builder
public class HGTParams {

    private String hitFile;

    private String prefix;

    @Builder.Default
    private int thresholdTaxonId = GlobalConfig.getIntValue("hgt.taxid.threshold");

    @Builder.Default
    private int skipTaxonId = GlobalConfig.getIntValue("hgt.taxid.skip");

    @Builder.Default
    private double supportThreshold = GlobalConfig.getDoubleValue("hgt.support.threshold");

    /** minimum hU, and minimum AI, for candidacy */
    @Builder.Default
    private double hgtIndexThreshold = GlobalConfig.getDoubleValue("hgt.hu.threshold");

    private boolean useAlienIndex;

    @Builder.Default
    private int queryColumn = GlobalConfig.getIntValue("hgt.column.query");

    @Builder.Default
    private int subjectColumn = GlobalConfig.getIntValue("hgt.column.subject");

    @Builder.Default
    private int evalueColumn = GlobalConfig.getIntValue("hgt.column.evalue");

    @Builder.Default
    private int bitscoreColumn = GlobalConfig.getIntValue("hgt.column.bitscore");

    @Builder.Default
    private int taxonColumn = GlobalConfig.getIntValue("hgt.column.taxid");

    @Builder.Default
    private Delimiter delimiter = Delimiter.of(GlobalConfig.getValue("hgt.delimiter"));

    private boolean verbose;

    public boolean hasSkipTaxon() {
        return skipTaxonId > 0;
    }

    public enum Delimiter {

        DIAMOND(Pattern.compile("\\s+")),

        BLAST(Pattern.compile("\t"));

        private final Pattern pattern;

        Delimiter(Pattern pattern) {
            this.pattern = pattern;
        }

        public String[] split(String line) {
            return this == DIAMOND
                    ? pattern.split(line.trim())
                    : pattern.split(line, -1);
        }

        /**
         * Accepts diamond/whitespace and blast/tab.
         */
        public static Delimiter of(String name) {
            switch (name.trim().toLowerCase()) {
                case "diamond":
                case "whitespace":
                    return DIAMOND;
                case "blast":
                case "tab":
                    return BLAST;
                default:
                    throw new IllegalArgumentException("Unknown delimiter '" + name
                            + "', please choose \"diamond\" or \"blast\"");
            }
        }
    }
}
