package phoenixcenter.hgtindex;

import lombok.extern.log4j.Log4j2;
import phoenixcenter.hgtindex.entity.CandidateDecision;
import phoenixcenter.hgtindex.entity.Category;
import phoenixcenter.hgtindex.entity.HGTParams;
import phoenixcenter.hgtindex.entity.HGTScore;
import phoenixcenter.hgtindex.entity.RunSummary;
import phoenixcenter.hgtindex.entity.SkipReason;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Runs the whole pipeline: hits to evidence, evidence to scores, scores to candidates.
 */
@Log4j2
public class HGTAnalysis {

    private final long progressHits = GlobalConfig.getIntValue("hgt.progress.hits");

    private final ResultWriter resultWriter = new ResultWriter();

    public RunSummary run(HGTParams params, TaxonomyStore taxonomy) throws IOException {
        Path hitFile = Paths.get(params.getHitFile());
        if (!Files.isReadable(hitFile)) {
            throw new IOException("Hit file '" + hitFile + "' cannot be read");
        }
        String ingroupName = ingroupName(params, taxonomy);
        log.info("Threshold taxid set to '{}' ({})", params.getThresholdTaxonId(), ingroupName);
        log.info("INGROUP set to '{}'; OUTGROUP is therefore 'non-{}'", ingroupName, ingroupName);
        if (params.hasSkipTaxon()) {
            log.info("Skipping any hits to taxid '{}' ({})", params.getSkipTaxonId(),
                    taxonomy.nameOf(params.getSkipTaxonId()).orElse("unknown"));
        } else {
            log.warn("Taxid to skip (-k) is not set! Suggest setting -k to the taxid of the phylum your organism comes from.");
        }
        if (!taxonomy.contains(params.getThresholdTaxonId())) {
            log.warn("Threshold taxid {} is not in the taxonomy, every hit will be OUTGROUP", params.getThresholdTaxonId());
        }

        LineageClassifier classifier = new LineageClassifier(taxonomy);
        AggregationResult aggregation = aggregate(params, classifier, hitFile);

        log.info("Calculating bestsum bitscore and hit support...");
        ScoringEngine scoringEngine = new ScoringEngine(classifier, params.getThresholdTaxonId());
        List<HGTScore> scores = scoringEngine.scoreAll(aggregation.getQuery2Evidence());
        CandidateSelector selector = new CandidateSelector(params.getHgtIndexThreshold(),
                params.getSupportThreshold(), params.isUseAlienIndex());
        List<CandidateDecision> decisions = selector.decideAll(scores);
        RunSummary summary = selector.summarize(decisions, aggregation);

        String prefix = prefix(params);
        String fileIngroupName = ingroupName.replaceAll("\\s+", "_");
        resultWriter.writeScores(Paths.get(prefix + ".HGT_results." + fileIngroupName + ".txt"),
                ingroupName, decisions, false);
        resultWriter.writeScores(Paths.get(prefix + ".HGT_candidates." + fileIngroupName
                        + ".supp" + ResultWriter.formatNumber(params.getSupportThreshold())
                        + ".hU" + ResultWriter.formatNumber(params.getHgtIndexThreshold()) + ".txt"),
                ingroupName, decisions, true);
        resultWriter.writeSummary(Paths.get(prefix + ".HGT_summary.json"), params, summary);

        logSummary(params, ingroupName, summary);
        return summary;
    }

    private AggregationResult aggregate(HGTParams params,
                                        LineageClassifier classifier,
                                        Path hitFile) throws IOException {
        log.info("Parsing hit file '{}'...", hitFile);
        AggregationResult aggregation;
        try (ResultWriter.WarningsLog warnings = resultWriter.openWarnings(
                Paths.get(prefix(params) + ".HGT_warnings.txt"), params.isVerbose())) {
            HitAggregator aggregator = new HitAggregator(classifier, params.getThresholdTaxonId(),
                    params.getSkipTaxonId(), warnings);
            new HitReader(params).read(hitFile, hit -> {
                aggregator.ingest(hit);
                if (hit.getLineNumber() % progressHits == 0) {
                    log.info("{} lines parsed", hit.getLineNumber());
                }
            });
            aggregation = aggregator.finish();
        }
        long total = aggregation.getTotalHits();
        log.info("Total number of hits parsed: {}", total);
        for (SkipReason reason : SkipReason.values()) {
            long skipped = aggregation.getSkipCount(reason);
            if (skipped > 0) {
                log.warn("There were {} ({}%) hits skipped: {}", skipped, percentage(skipped, total),
                        reason.getDescription());
            }
        }
        return aggregation;
    }

    private void logSummary(HGTParams params, String ingroupName, RunSummary summary) {
        String hU = ResultWriter.formatNumber(params.getHgtIndexThreshold());
        String support = ResultWriter.formatNumber(params.getSupportThreshold());
        log.info("Processed {} queries", summary.getQueries());
        log.info("TOTAL NUMBER OF HGT CANDIDATES: {}", summary.getCandidates());
        log.info("Number of queries with HGT Index (hU) >= {}: {}", hU, summary.getHgtIndexSupported());
        log.info("Number of queries with Alien Index (AI) >= {}: {}", hU, summary.getAlienIndexSupported());
        log.info("Number of queries in INGROUP category ('{}'): {}", ingroupName, summary.getIngroup());
        log.info("Number of queries in INGROUP category ('{}') with support >= {}%: {}", ingroupName, support,
                summary.getIngroupSupported());
        log.info("Number of queries in OUTGROUP category ('non-{}'): {}", ingroupName, summary.getOutgroup());
        log.info("Number of queries in OUTGROUP category ('non-{}') with support >= {}%: {}", ingroupName, support,
                summary.getOutgroupSupported());
        for (SkipReason reason : SkipReason.values()) {
            if (summary.getSkipped(reason) > 0) {
                log.info("Hits skipped as {}: {}", reason, summary.getSkipped(reason));
            }
        }
        if (summary.getQueriesWithoutEvidence() > 0) {
            log.info("Number of queries without any retained hit: {}", summary.getQueriesWithoutEvidence());
        }
    }

    /**
     * Label every hit of a candidate query with the category of its taxon, e.g. "UniRef90_X_OUT".
     * Hits whose taxon cannot be classified are left out.
     *
     * @return the number of labelled hits
     */
    public long labelCandidateHits(Path candidatesFile,
                                   HGTParams params,
                                   TaxonomyStore taxonomy,
                                   Path labelFile) throws IOException {
        Set<String> candidates = readQueryIds(candidatesFile);
        log.info("Number of HGT candidates: {}", candidates.size());
        LineageClassifier classifier = new LineageClassifier(taxonomy);
        long[] labelled = {0L};
        try (BufferedWriter bw = Files.newBufferedWriter(labelFile)) {
            bw.write(String.join("\t", "#QUERY", "SUBJECT", "LABEL") + System.lineSeparator());
            new HitReader(params).read(Paths.get(params.getHitFile()), hit -> {
                if (!candidates.contains(hit.getQueryId())) {
                    return;
                }
                int taxonId = HitAggregator.parseTaxonId(hit.getTaxonToken());
                if (taxonId <= 0 || !taxonomy.contains(taxonId)) {
                    return;
                }
                Category category;
                try {
                    category = classifier.classify(taxonId, params.getThresholdTaxonId());
                } catch (MalformedTaxonomyException e) {
                    log.debug(e.getMessage());
                    return;
                }
                if (category == Category.UNASSIGNED) {
                    return;
                }
                String label = hit.getSubjectId() + "_" + category.shortLabel();
                log.debug("{} --> {}", hit.getQueryId(), label);
                try {
                    bw.write(String.join("\t", hit.getQueryId(), hit.getSubjectId(), label) + System.lineSeparator());
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                labelled[0]++;
            });
        }
        log.info("{} hits of candidate queries labelled", labelled[0]);
        return labelled[0];
    }

    /**
     * First column of a results or candidates table.
     */
    private static Set<String> readQueryIds(Path tableFile) throws IOException {
        Set<String> queryIds = new HashSet<>();
        try (BufferedReader br = TextFiles.newReader(tableFile)) {
            String line;
            while ((line = br.readLine()) != null) {
                if (line.startsWith("#") || line.isBlank()) {
                    continue;
                }
                queryIds.add(line.split("\t", 2)[0].trim());
            }
        }
        return queryIds;
    }

    public static String ingroupName(HGTParams params, TaxonomyStore taxonomy) {
        return taxonomy.nameOf(params.getThresholdTaxonId())
                .orElse(String.valueOf(params.getThresholdTaxonId()));
    }

    public static String prefix(HGTParams params) {
        return params.getPrefix() == null ? params.getHitFile() : params.getPrefix();
    }

    private static String percentage(long numerator, long denominator) {
        return denominator == 0 ? "0.00" : String.format(Locale.ROOT, "%.2f", 100.0 * numerator / denominator);
    }
}
