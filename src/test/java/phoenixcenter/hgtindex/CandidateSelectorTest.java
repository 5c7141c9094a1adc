package phoenixcenter.hgtindex;

import org.junit.Test;
import phoenixcenter.hgtindex.entity.CandidateDecision;
import phoenixcenter.hgtindex.entity.Category;
import phoenixcenter.hgtindex.entity.HGTScore;
import phoenixcenter.hgtindex.entity.Hit;
import phoenixcenter.hgtindex.entity.RunSummary;
import phoenixcenter.hgtindex.entity.SkipReason;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CandidateSelectorTest {

    CandidateSelector selector = new CandidateSelector(30, 90, false);

    private static HGTScore score(String queryId, double hU, double ai, Category category, Double support) {
        return HGTScore.builder()
                .queryId(queryId)
                .hgtIndex(hU)
                .alienIndex(ai)
                .winningCategory(category)
                .support(support)
                .taxonCount(support == null ? 0 : 3)
                .build();
    }

    @Test
    public void candidateNeedsScoreCategoryAndSupport() {
        assertTrue(selector.decide(score("q", 30, 0, Category.OUTGROUP, 90.0)).isCandidate());
        assertFalse(selector.decide(score("q", 29.9, 100, Category.OUTGROUP, 100.0)).isCandidate());
        assertFalse(selector.decide(score("q", 200, 100, Category.INGROUP, 100.0)).isCandidate());
        assertFalse(selector.decide(score("q", 200, 100, Category.OUTGROUP, 89.99)).isCandidate());
    }

    @Test
    public void wellScoredQueryWithWeakSupportIsNotCandidate() {
        ScoringEngine scoringEngine = new ScoringEngine(new LineageClassifier(TaxonomyFixtures.store()),
                TaxonomyFixtures.METAZOA);
        QueryEvidence evidence = new QueryEvidence("q");
        evidence.add(TaxonomyFixtures.HUMAN, 100, 1e-20);
        evidence.add(TaxonomyFixtures.E_COLI, 150, 1e-30);
        evidence.add(TaxonomyFixtures.YEAST, 10, 1e-5);
        CandidateDecision decision = selector.decide(scoringEngine.score("q", evidence));

        assertEquals(50.0, decision.getScore().getHgtIndex(), 1e-9);
        assertFalse(decision.isCandidate());
    }

    @Test
    public void supportComparedBeforeRounding() {
        HGTScore score = score("q", 100, 50, Category.OUTGROUP, 89.996);
        assertEquals("90.00", ResultWriter.formatSupport(score.getSupport()));
        assertFalse(selector.isSupported(score));
        assertFalse(selector.decide(score).isCandidate());
    }

    @Test
    public void undefinedSupportNeverPasses() {
        CandidateSelector lenient = new CandidateSelector(-1000, 0, false);
        assertFalse(lenient.decide(score("q", 0, 0, Category.OUTGROUP, null)).isCandidate());
        assertFalse(lenient.isSupported(score("q", 0, 0, Category.OUTGROUP, null)));
    }

    @Test
    public void alienIndexMode() {
        CandidateSelector aiSelector = new CandidateSelector(30, 90, true);
        assertTrue(aiSelector.decide(score("q", 0, 45, Category.OUTGROUP, 100.0)).isCandidate());
        assertFalse(aiSelector.decide(score("q", 300, 10, Category.OUTGROUP, 100.0)).isCandidate());
    }

    @Test
    public void summarize() {
        List<CandidateDecision> decisions = selector.decideAll(Arrays.asList(
                score("q1", 50, 10, Category.OUTGROUP, 200.0 / 3),
                score("q2", 200, 60, Category.OUTGROUP, 100.0),
                score("q3", -250, -75, Category.INGROUP, 200.0 / 3),
                score("q4", 0, 0, Category.OUTGROUP, null),
                score("q5", -40, -10, Category.INGROUP, 100.0)));
        HitAggregator aggregator = new HitAggregator(new LineageClassifier(TaxonomyFixtures.store()),
                TaxonomyFixtures.METAZOA, 0, null);
        aggregator.ingest(Hit.builder().queryId("q4").taxonToken("NA").build());
        RunSummary summary = selector.summarize(decisions, aggregator.finish());

        assertEquals(5L, summary.getQueries());
        assertEquals(1L, summary.getQueriesWithoutEvidence());
        assertEquals(2L, summary.getHgtIndexSupported());
        assertEquals(1L, summary.getAlienIndexSupported());
        assertEquals(2L, summary.getIngroup());
        assertEquals(1L, summary.getIngroupSupported());
        assertEquals(2L, summary.getOutgroup());
        assertEquals(1L, summary.getOutgroupSupported());
        assertEquals(1L, summary.getCandidates());
        assertEquals(1L, summary.getTotalHits());
        assertEquals(1L, summary.getSkipped(SkipReason.INVALID_TAXID));
    }
}
