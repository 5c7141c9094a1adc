package phoenixcenter.hgtindex.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateDecision {

    private boolean candidate;

    private HGTScore score;
}
