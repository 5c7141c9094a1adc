package phoenixcenter.hgtindex.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HGTScore {

    private String queryId;

    /** HGT index: best outgroup bitscore minus best ingroup bitscore */
    private double hgtIndex;

    /** Alien index: log10(best ingroup evalue) minus log10(best outgroup evalue) */
    private double alienIndex;

    private double ingroupBestBitscore;

    private double outgroupBestBitscore;

    private double ingroupBestEvalue;

    private double outgroupBestEvalue;

    private double ingroupBitscoreSum;

    private double outgroupBitscoreSum;

    private Category winningCategory;

    /** taxon with the highest bitscore sum, null without evidence */
    private Integer winningTaxon;

    /** consensus hit support in percent, null (undefined) without evidence */
    private Double support;

    private int taxonCount;

    private String lineage;

    public boolean hasEvidence() {
        return taxonCount > 0;
    }

    public boolean isSupportDefined() {
        return support != null;
    }
}
