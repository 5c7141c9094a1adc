package phoenixcenter.hgtindex.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaxonNode {

    private Integer id;

    private Integer parentId;

    private String rank;

    private String name;
}
