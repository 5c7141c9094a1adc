package phoenixcenter.hgtindex;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.OptionalInt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TaxonomyLoaderTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void fromDumpDirectory() throws IOException {
        Path dir = folder.newFolder("taxdump").toPath();
        TaxonomyFixtures.writeDumps(dir);
        TaxonomyStore store = TaxonomyLoader.fromDumpDirectory(dir);

        assertEquals(OptionalInt.of(TaxonomyFixtures.METAZOA), store.parentOf(TaxonomyFixtures.CHORDATA));
        assertEquals("phylum", store.rankOf(TaxonomyFixtures.CHORDATA).get());
        // synonyms are ignored
        assertEquals("Chordata", store.nameOf(TaxonomyFixtures.CHORDATA).get());
        assertEquals(OptionalInt.of(TaxonomyFixtures.HUMAN), store.parentOf(TaxonomyFixtures.OLD_HUMAN));
    }

    @Test
    public void fromDumpFilesWithoutMerged() throws IOException {
        Path dir = folder.newFolder("taxdump").toPath();
        TaxonomyFixtures.writeDumps(dir);
        TaxonomyStore store = TaxonomyLoader.fromDumpFiles(dir.resolve("nodes.dmp"), dir.resolve("names.dmp"), null);

        assertTrue(store.contains(TaxonomyFixtures.HUMAN));
        assertFalse(store.contains(TaxonomyFixtures.OLD_HUMAN));
    }

    @Test
    public void fromNodesDB() throws IOException {
        Path file = folder.newFile("nodesDB.txt").toPath();
        TaxonomyFixtures.writeNodesDB(file);
        TaxonomyStore store = TaxonomyLoader.fromNodesDB(file);

        assertEquals(OptionalInt.of(TaxonomyFixtures.ASCOMYCOTA), store.parentOf(TaxonomyFixtures.YEAST));
        assertEquals("Saccharomyces cerevisiae", store.nameOf(TaxonomyFixtures.YEAST).get());
        assertEquals("species", store.rankOf(TaxonomyFixtures.YEAST).get());
    }

    @Test
    public void malformedAndCommentLinesAreIgnored() throws IOException {
        Path dir = folder.newFolder("taxdump").toPath();
        Files.write(dir.resolve("nodes.dmp"), Arrays.asList(
                "# generated",
                "1\t|\t1\t|\tno rank\t|",
                "2\t|\t1\t|\tsuperkingdom\t|",
                "x\t|\t1\t|\tspecies\t|",
                "3\t|\t2",
                "",
                "562\t|\t2\t|\tspecies\t|"));
        Files.write(dir.resolve("names.dmp"), Arrays.asList(
                "1\t|\troot\t|\t\t|\tscientific name\t|",
                "2\t|\tBacteria\t|\t\t|\tscientific name\t|",
                "2\t|\tEubacteria\t|\t\t|\tgenbank synonym\t|",
                "562\t|\tEscherichia coli\t|\t\t|\tscientific name\t|"));
        TaxonomyStore store = TaxonomyLoader.fromDumpDirectory(dir);

        assertEquals(3, store.size());
        assertFalse(store.contains(3));
        assertEquals("Bacteria", store.nameOf(2).get());
    }

    @Test(expected = IOException.class)
    public void missingDirectory() throws IOException {
        TaxonomyLoader.fromDumpDirectory(folder.getRoot().toPath().resolve("absent"));
    }
}
