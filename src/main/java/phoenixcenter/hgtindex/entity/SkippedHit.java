package phoenixcenter.hgtindex.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SkippedHit {

    private String queryId;

    private long lineNumber;

    private String taxonToken;

    private SkipReason reason;
}
