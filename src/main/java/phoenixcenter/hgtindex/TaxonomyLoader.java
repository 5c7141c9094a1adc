package phoenixcenter.hgtindex;

import lombok.extern.log4j.Log4j2;
import phoenixcenter.hgtindex.entity.TaxonNode;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Builds a {@link TaxonomyStore} from NCBI taxdump files or from a blobtools nodesDB table.
 */
@Log4j2
public class TaxonomyLoader {

    public static final String SCIENTIFIC_NAME = "scientific name";

    private static final Pattern DUMP_SEPARATOR = Pattern.compile("\\|");

    private static final Pattern TAB = Pattern.compile("\t");

    private TaxonomyLoader() {
    }

    /**
     * Load nodes.dmp and names.dmp, and merged.dmp when it exists, from a taxdump directory.
     */
    public static TaxonomyStore fromDumpDirectory(Path dumpDir) throws IOException {
        if (!Files.isDirectory(dumpDir)) {
            throw new NoSuchFileException(dumpDir.toString(), null, "taxonomy directory not found");
        }
        Path merged = dumpDir.resolve("merged.dmp");
        return fromDumpFiles(dumpDir.resolve("nodes.dmp"),
                dumpDir.resolve("names.dmp"),
                Files.exists(merged) ? merged : null);
    }

    /**
     * @param mergedFile may be null
     */
    public static TaxonomyStore fromDumpFiles(Path nodesFile, Path namesFile, Path mergedFile) throws IOException {
        log.info("Building taxonomy databases from '{}' and '{}'", nodesFile, namesFile);
        TaxonomyStore.Builder builder = TaxonomyStore.builder();
        long nodes = readDump(nodesFile, 3, fields -> builder.addNode(TaxonNode.builder()
                .id(Integer.parseInt(fields[0]))
                .parentId(Integer.parseInt(fields[1]))
                .rank(fields[2])
                .build()));
        long names = readDump(namesFile, 4, fields -> {
            if (SCIENTIFIC_NAME.equals(fields[3])) {
                builder.addName(Integer.parseInt(fields[0]), fields[1]);
            }
        });
        long merged = 0L;
        if (mergedFile != null) {
            merged = readDump(mergedFile, 2, fields -> builder.addRedirect(Integer.parseInt(fields[0]),
                    Integer.parseInt(fields[1])));
        }
        TaxonomyStore store = builder.build();
        log.info("Nodes parsed: {} ({} name rows, {} merged taxids)", nodes, names, merged);
        return store;
    }

    /**
     * Load a blobtools nodesDB file: taxid, rank, name and parent taxid separated by tabs.
     */
    public static TaxonomyStore fromNodesDB(Path nodesDBFile) throws IOException {
        log.info("Building taxonomy databases from '{}'", nodesDBFile);
        TaxonomyStore.Builder builder = TaxonomyStore.builder();
        long nodes = readTable(nodesDBFile, TAB, 4, fields -> builder.addNode(TaxonNode.builder()
                .id(Integer.parseInt(fields[0].trim()))
                .rank(fields[1])
                .name(fields[2])
                .parentId(Integer.parseInt(fields[3].trim()))
                .build()));
        TaxonomyStore store = builder.build();
        log.info("Nodes parsed: {}", nodes);
        return store;
    }

    private static long readDump(Path file, int minFields, Consumer<String[]> rowConsumer) throws IOException {
        return readTable(file, DUMP_SEPARATOR, minFields, fields -> rowConsumer.accept(
                Arrays.stream(fields).map(String::trim).toArray(String[]::new)));
    }

    /**
     * Feed every data row to the consumer. Lines containing '#' are headers or comments.
     *
     * @return the number of rows accepted
     */
    private static long readTable(Path file,
                                  Pattern separator,
                                  int minFields,
                                  Consumer<String[]> rowConsumer) throws IOException {
        long accepted = 0L;
        long rejected = 0L;
        try (BufferedReader br = TextFiles.newReader(file)) {
            String line;
            while ((line = br.readLine()) != null) {
                if (line.indexOf('#') >= 0 || line.isBlank()) {
                    continue;
                }
                String[] fields = separator.split(line, -1);
                if (fields.length < minFields) {
                    rejected++;
                    log.debug("Bad line in {}: {}", file, line);
                    continue;
                }
                try {
                    rowConsumer.accept(fields);
                    accepted++;
                } catch (NumberFormatException e) {
                    rejected++;
                    log.debug("Bad line in {}: {}", file, line);
                }
            }
        }
        if (rejected > 0) {
            log.warn("{} malformed lines ignored in {}", rejected, file);
        }
        return accepted;
    }
}
