package phoenixcenter.hgtindex;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.log4j.Log4j2;
import phoenixcenter.hgtindex.entity.CandidateDecision;
import phoenixcenter.hgtindex.entity.HGTParams;
import phoenixcenter.hgtindex.entity.HGTScore;
import phoenixcenter.hgtindex.entity.RunSummary;
import phoenixcenter.hgtindex.entity.SkipReason;
import phoenixcenter.hgtindex.entity.SkippedHit;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Tab separated result tables, the warnings log and the JSON run summary.
 */
@Log4j2
public class ResultWriter {

    public static final String[] HEADER = {
            "QUERY",
            "INGROUP_NAME",
            "hU",
            "BIT_OUT",
            "BIT_IN",
            "AI",
            "EVAL_OUT",
            "EVAL_IN",
            "WINNING_CATEGORY",
            "SUPPORT",
            "LINEAGE"
    };

    public static final String UNDEFINED_SUPPORT = "undefined";

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Write one row per decision; with candidatesOnly, only the rows that passed.
     *
     * @return the number of rows written
     */
    public long writeScores(Path file,
                            String ingroupName,
                            List<CandidateDecision> decisions,
                            boolean candidatesOnly) throws IOException {
        long rows = 0L;
        try (BufferedWriter bw = Files.newBufferedWriter(file)) {
            bw.write("#\t" + String.join("\t", HEADER) + System.lineSeparator());
            for (CandidateDecision decision : decisions) {
                if (candidatesOnly && !decision.isCandidate()) {
                    continue;
                }
                bw.write(formatRow(decision.getScore(), ingroupName) + System.lineSeparator());
                rows += 1L;
            }
        }
        log.debug("{} rows written to {}", rows, file);
        return rows;
    }

    public String formatRow(HGTScore score, String ingroupName) {
        return String.join("\t",
                score.getQueryId(),
                ingroupName,
                formatNumber(score.getHgtIndex()),
                formatNumber(score.getOutgroupBestBitscore()),
                formatNumber(score.getIngroupBestBitscore()),
                formatNumber(score.getAlienIndex()),
                formatNumber(score.getOutgroupBestEvalue()),
                formatNumber(score.getIngroupBestEvalue()),
                score.getWinningCategory().name(),
                formatSupport(score.getSupport()),
                score.getLineage());
    }

    public void writeSummary(Path file, HGTParams params, RunSummary summary) throws IOException {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("parameters", params);
        content.put("summary", summary);
        objectMapper.writeValue(file.toFile(), content);
    }

    /**
     * @param verbose also log hits dropped because they fall in the skipped clade
     */
    public WarningsLog openWarnings(Path file, boolean verbose) throws IOException {
        return new WarningsLog(Files.newBufferedWriter(file), verbose);
    }

    static String formatSupport(Double support) {
        return support == null ? UNDEFINED_SUPPORT : String.format(Locale.ROOT, "%.2f", support);
    }

    /**
     * Integral values without decimals, everything else as Java prints doubles.
     */
    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    public static class WarningsLog implements Consumer<SkippedHit>, Closeable {

        private final BufferedWriter bw;

        private final boolean verbose;

        private WarningsLog(BufferedWriter bw, boolean verbose) {
            this.bw = bw;
            this.verbose = verbose;
        }

        @Override
        public void accept(SkippedHit skippedHit) {
            if (skippedHit.getReason() == SkipReason.SKIPPED_TAXON && !verbose) {
                return;
            }
            try {
                bw.write(String.join("\t",
                        String.valueOf(skippedHit.getQueryId()),
                        Long.toString(skippedHit.getLineNumber()),
                        String.valueOf(skippedHit.getTaxonToken()),
                        skippedHit.getReason().name())
                        + System.lineSeparator());
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void close() throws IOException {
            bw.close();
        }
    }
}
