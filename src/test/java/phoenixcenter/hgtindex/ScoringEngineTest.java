package phoenixcenter.hgtindex;

import org.junit.Test;
import phoenixcenter.hgtindex.entity.Category;
import phoenixcenter.hgtindex.entity.HGTScore;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ScoringEngineTest {

    ScoringEngine scoringEngine = new ScoringEngine(new LineageClassifier(TaxonomyFixtures.store()),
            TaxonomyFixtures.METAZOA);

    private static QueryEvidence evidence(String queryId, double[]... rows) {
        QueryEvidence evidence = new QueryEvidence(queryId);
        for (double[] row : rows) {
            evidence.add((int) row[0], row[1], row[2]);
        }
        return evidence;
    }

    private static double[] row(int taxonId, double bitscore, double evalue) {
        return new double[]{taxonId, bitscore, evalue};
    }

    @Test
    public void hgtIndexIsBitscoreDifference() {
        HGTScore score = scoringEngine.score("q", evidence("q",
                row(TaxonomyFixtures.HUMAN, 50, 1e-10),
                row(TaxonomyFixtures.E_COLI, 90, 1e-20)));
        assertEquals(40.0, score.getHgtIndex(), 1e-9);
        assertEquals(90.0, score.getOutgroupBestBitscore(), 0.0);
        assertEquals(50.0, score.getIngroupBestBitscore(), 0.0);
    }

    @Test
    public void alienIndexFromEvalues() {
        HGTScore score = scoringEngine.score("q", evidence("q",
                row(TaxonomyFixtures.HUMAN, 50, 1e-10),
                row(TaxonomyFixtures.E_COLI, 90, 1e-50)));
        assertEquals(40.0, score.getAlienIndex(), 1e-9);
    }

    @Test
    public void zeroEvalueStaysFinite() {
        HGTScore score = scoringEngine.score("q", evidence("q", row(TaxonomyFixtures.E_COLI, 900, 0.0)));
        assertEquals(200.0, score.getAlienIndex(), 1e-9);
    }

    @Test
    public void supportIsShareOfAgreeingTaxa() {
        HGTScore score = scoringEngine.score("q", evidence("q",
                row(TaxonomyFixtures.HUMAN, 10, 1e-5),
                row(TaxonomyFixtures.C_ELEGANS, 10, 1e-5),
                row(TaxonomyFixtures.E_COLI, 100, 1e-40),
                row(TaxonomyFixtures.YEAST, 5, 1e-3),
                row(TaxonomyFixtures.ASCOMYCOTA, 5, 1e-3)));
        assertEquals(Category.OUTGROUP, score.getWinningCategory());
        assertEquals(60.0, score.getSupport(), 1e-9);
        assertEquals(5, score.getTaxonCount());
        assertEquals(Integer.valueOf(TaxonomyFixtures.E_COLI), score.getWinningTaxon());
    }

    @Test
    public void tieGoesToOutgroup() {
        HGTScore score = scoringEngine.score("q", evidence("q",
                row(TaxonomyFixtures.HUMAN, 60, 1e-10),
                row(TaxonomyFixtures.E_COLI, 60, 1e-10)));
        assertEquals(Category.OUTGROUP, score.getWinningCategory());
        assertEquals(50.0, score.getSupport(), 1e-9);
        // equal sums keep the lowest taxid
        assertEquals(Integer.valueOf(TaxonomyFixtures.E_COLI), score.getWinningTaxon());
        assertEquals("Bacteria;undef;Proteobacteria", score.getLineage());
    }

    @Test
    public void mixedEvidence() {
        HGTScore score = scoringEngine.score("q", evidence("q",
                row(TaxonomyFixtures.HUMAN, 100, 1e-20),
                row(TaxonomyFixtures.E_COLI, 150, 1e-30),
                row(TaxonomyFixtures.YEAST, 10, 1e-5)));
        assertEquals(50.0, score.getHgtIndex(), 1e-9);
        assertEquals(Category.OUTGROUP, score.getWinningCategory());
        assertEquals(200.0 / 3, score.getSupport(), 1e-9);
        assertEquals(160.0, score.getOutgroupBitscoreSum(), 1e-9);
        assertEquals(100.0, score.getIngroupBitscoreSum(), 1e-9);
    }

    @Test
    public void bestEvalueNeverAboveOne() {
        HGTScore score = scoringEngine.score("q", evidence("q", row(TaxonomyFixtures.HUMAN, 20, 5.0)));
        assertEquals(1.0, score.getIngroupBestEvalue(), 0.0);
        assertEquals(1.0, score.getOutgroupBestEvalue(), 0.0);
        assertEquals(Category.INGROUP, score.getWinningCategory());
        assertEquals(100.0, score.getSupport(), 1e-9);
        assertEquals("Eukaryota;Metazoa;Chordata", score.getLineage());
    }

    @Test
    public void noEvidence() {
        HGTScore score = scoringEngine.score("q", new QueryEvidence("q"));
        assertFalse(score.hasEvidence());
        assertNull(score.getSupport());
        assertNull(score.getWinningTaxon());
        assertEquals(0.0, score.getHgtIndex(), 0.0);
        assertEquals(0.0, score.getAlienIndex(), 1e-12);
        assertEquals("undef;undef;undef", score.getLineage());
    }

    @Test
    public void scoreAllSortsQueriesNaturally() {
        Map<String, QueryEvidence> query2Evidence = new HashMap<>();
        for (String q : new String[]{"gene10", "gene2", "gene1"}) {
            query2Evidence.put(q, evidence(q, row(TaxonomyFixtures.E_COLI, 50, 1e-10)));
        }
        List<HGTScore> scores = scoringEngine.scoreAll(query2Evidence);
        assertEquals(Arrays.asList("gene1", "gene2", "gene10"),
                scores.stream().map(HGTScore::getQueryId).collect(Collectors.toList()));
        assertTrue(scores.stream().allMatch(HGTScore::isSupportDefined));
    }
}
