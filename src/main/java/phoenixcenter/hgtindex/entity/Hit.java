package phoenixcenter.hgtindex.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of similarity search output. Scores that could not be read are NaN and the taxon
 * is kept as the raw token, so that validation happens in one place.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Hit {

    private String queryId;

    private String subjectId;

    private double evalue;

    private double bitscore;

    private String taxonToken;

    private long lineNumber;
}
