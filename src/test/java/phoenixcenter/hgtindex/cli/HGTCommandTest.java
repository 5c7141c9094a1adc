package phoenixcenter.hgtindex.cli;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import phoenixcenter.hgtindex.TaxonomyFixtures;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class HGTCommandTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    HGTCommand hgtCommand = new HGTCommand();

    private Path taxdump() throws IOException {
        Path dir = folder.newFolder("taxdump").toPath();
        TaxonomyFixtures.writeDumps(dir);
        return dir;
    }

    private Path hits() throws IOException {
        Path hitFile = folder.newFile("hits.txt").toPath();
        Files.write(hitFile, Arrays.asList(
                TaxonomyFixtures.hitLine("g1", "sB", "1e-60", "200", "562"),
                TaxonomyFixtures.hitLine("g1", "sC", "1e-20", "80", "4932"),
                TaxonomyFixtures.hitLine("g2", "sA", "1e-80", "300", "9606"),
                TaxonomyFixtures.hitLine("g2", "sD", "1e-70", "250", "6239")));
        return hitFile;
    }

    @Test
    public void diamond2hgt() throws IOException {
        /*
         HGT diamond2hgt -i hits.txt -p taxdump -k 6231 -x run
         */
        Path taxdump = taxdump();
        Path hitFile = hits();
        String prefix = folder.getRoot().toPath().resolve("run").toString();
        int exitCode = new CommandLine(hgtCommand).execute("diamond2hgt",
                "-i", hitFile.toString(), "-p", taxdump.toString(), "-k", "6231", "-x", prefix);

        assertEquals(0, exitCode);
        List<String> candidates = Files.readAllLines(Paths.get(prefix + ".HGT_candidates.Metazoa.supp90.hU30.txt"));
        assertEquals(2, candidates.size());
        assertTrue(candidates.get(1).startsWith("g1\t"));
        assertTrue(Files.exists(Paths.get(prefix + ".HGT_summary.json")));
    }

    @Test
    public void diamond2hgtWithNodesDBAndThresholds() throws IOException {
        Path nodesDB = folder.newFile("nodesDB.txt").toPath();
        TaxonomyFixtures.writeNodesDB(nodesDB);
        Path hitFile = hits();
        int exitCode = new CommandLine(hgtCommand).execute("diamond2hgt",
                "-i", hitFile.toString(), "-n", nodesDB.toString(), "-s", "50", "-l", "100", "--AI");

        assertEquals(0, exitCode);
        assertTrue(Files.exists(Paths.get(hitFile + ".HGT_candidates.Metazoa.supp50.hU100.txt")));
    }

    @Test
    public void lineage() throws IOException {
        Path taxdump = taxdump();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        hgtCommand.setOut(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        int exitCode = new CommandLine(hgtCommand).execute("lineage", "-p", taxdump.toString(), "562", "9606");

        assertEquals(0, exitCode);
        String[] lines = bytes.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals(3, lines.length);
        assertEquals("562\tEscherichia coli\tspecies\tOUTGROUP\tBacteria;undef;Proteobacteria\t"
                + "Bacteria;undef;Proteobacteria;undef;undef;undef;undef;undef", lines[1]);
        assertTrue(lines[2].startsWith("9606\tHomo sapiens\tspecies\tINGROUP\t"));
    }

    @Test
    public void labelHits() throws IOException {
        Path taxdump = taxdump();
        Path hitFile = hits();
        Path candidates = folder.newFile("candidates.txt").toPath();
        Files.write(candidates, Arrays.asList("#\tQUERY\tINGROUP_NAME", "g2\tMetazoa"));
        Path labels = folder.getRoot().toPath().resolve("labels.txt");
        int exitCode = new CommandLine(hgtCommand).execute("label-hits", "-i", candidates.toString(),
                "-r", hitFile.toString(), "-p", taxdump.toString(), "-O", labels.toString());

        assertEquals(0, exitCode);
        assertEquals(Arrays.asList("#QUERY\tSUBJECT\tLABEL", "g2\tsA\tsA_IN", "g2\tsD\tsD_IN"),
                Files.readAllLines(labels));
    }

    @Test
    public void taxonomyIsRequired() throws IOException {
        Path hitFile = hits();
        assertNotEquals(0, new CommandLine(hgtCommand).execute("diamond2hgt", "-i", hitFile.toString()));
    }

    @Test
    public void unknownDelimiterFails() throws IOException {
        Path taxdump = taxdump();
        Path hitFile = hits();
        assertNotEquals(0, new CommandLine(hgtCommand).execute("diamond2hgt",
                "-i", hitFile.toString(), "-p", taxdump.toString(), "-d", "comma"));
    }
}
