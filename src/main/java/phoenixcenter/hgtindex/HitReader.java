package phoenixcenter.hgtindex;

import lombok.extern.log4j.Log4j2;
import phoenixcenter.hgtindex.entity.HGTParams;
import phoenixcenter.hgtindex.entity.Hit;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Reads taxified Diamond/BLAST tabular output. Column positions are 1-based.
 */
@Log4j2
public class HitReader {

    private final HGTParams.Delimiter delimiter;

    private final int queryIdx;

    private final int subjectIdx;

    private final int evalueIdx;

    private final int bitscoreIdx;

    private final int taxonIdx;

    public HitReader(HGTParams params) {
        this.delimiter = params.getDelimiter();
        this.queryIdx = toIndex("query", params.getQueryColumn());
        this.subjectIdx = toIndex("subject", params.getSubjectColumn());
        this.evalueIdx = toIndex("evalue", params.getEvalueColumn());
        this.bitscoreIdx = toIndex("bitscore", params.getBitscoreColumn());
        this.taxonIdx = toIndex("taxid", params.getTaxonColumn());
    }

    /**
     * Stream all hits of a file to the consumer, skipping comment and blank lines.
     *
     * @return the number of hits read
     */
    public long read(Path hitFile, Consumer<Hit> hitConsumer) throws IOException {
        long lineNumber = 0L;
        long hits = 0L;
        try (BufferedReader br = TextFiles.newReader(hitFile)) {
            String line;
            while ((line = br.readLine()) != null) {
                lineNumber += 1L;
                Hit hit = parseLine(line, lineNumber);
                if (hit != null) {
                    hitConsumer.accept(hit);
                    hits += 1L;
                }
            }
        }
        log.debug("{} hits read from {} lines of {}", hits, lineNumber, hitFile);
        return hits;
    }

    /**
     * @return the hit, or null for comment and blank lines
     */
    public Hit parseLine(String line, long lineNumber) {
        if (line.startsWith("#") || line.isBlank()) {
            return null;
        }
        String[] fields = delimiter.split(line);
        return Hit.builder()
                .queryId(field(fields, queryIdx))
                .subjectId(field(fields, subjectIdx))
                .evalue(toDouble(field(fields, evalueIdx)))
                .bitscore(toDouble(field(fields, bitscoreIdx)))
                .taxonToken(field(fields, taxonIdx))
                .lineNumber(lineNumber)
                .build();
    }

    private static String field(String[] fields, int idx) {
        return idx < fields.length ? fields[idx] : null;
    }

    private static double toDouble(String value) {
        if (value == null) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    private static int toIndex(String name, int column) {
        if (column < 1) {
            throw new IllegalArgumentException(name + " column must be 1 or more, got " + column);
        }
        return column - 1;
    }
}
