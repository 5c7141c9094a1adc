package phoenixcenter.hgtindex.cli;


import lombok.extern.log4j.Log4j2;
import phoenixcenter.hgtindex.GlobalConfig;
import phoenixcenter.hgtindex.HGTAnalysis;
import phoenixcenter.hgtindex.LineageClassifier;
import phoenixcenter.hgtindex.MalformedTaxonomyException;
import phoenixcenter.hgtindex.TaxonomyLoader;
import phoenixcenter.hgtindex.TaxonomyStore;
import phoenixcenter.hgtindex.entity.HGTParams;
import phoenixcenter.hgtindex.entity.RunSummary;
import phoenixcenter.hgtindex.entity.TaxonNode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;

@Log4j2
@Command(name = "HGT", mixinStandardHelpOptions = true, version = "HGT 1.0",
        description = "Categorise taxified Diamond/BLAST hits into INGROUP and OUTGROUP and score HGT candidates")
public class HGTCommand implements Callable<Integer> {

    private HGTAnalysis hgtAnalysis = new HGTAnalysis();

    private PrintStream out = System.out;

    @Command(name = "diamond2hgt", description = "Calculate hU, AI and consensus hit support for each query")
    public int diamond2hgt(
            @Option(names = {"-i", "--in"}, description = "Taxified diamond/BLAST results file", required = true) String hitFile,
            @Option(names = {"-p", "--path"}, description = "Directory containing nodes.dmp, names.dmp and optionally merged.dmp") String path,
            @Option(names = {"-o", "--nodes"}, description = "Path to nodes.dmp") String nodesFile,
            @Option(names = {"-a", "--names"}, description = "Path to names.dmp") String namesFile,
            @Option(names = {"-m", "--merged"}, description = "Path to merged.dmp") String mergedFile,
            @Option(names = {"-n", "--nodesDB"}, description = "nodesDB.txt file from blobtools") String nodesDBFile,
            @Option(names = {"-t", "--taxid_ingroup"}, description = "NCBI taxid to define 'ingroup', default 33208 (Metazoa)") Integer ingroupTaxid,
            @Option(names = {"-k", "--taxid_skip"}, description = "NCBI taxid to skip; hits within this taxid will not be considered") Integer skipTaxid,
            @Option(names = {"-s", "--support_threshold"}, description = "Consensus hit support threshold for HGT candidates, default 90%%") Double supportThreshold,
            @Option(names = {"-l", "--hU_threshold"}, description = "hU threshold for HGT candidates, default 30, also the AI threshold") Double hUThreshold,
            @Option(names = "--AI", description = "Use AI instead of hU to select candidates") boolean useAlienIndex,
            @Option(names = {"-q", "--query_column"}, description = "Query column, first column = 1, default 1") Integer queryColumn,
            @Option(names = {"-j", "--subject_column"}, description = "Subject column, default 2") Integer subjectColumn,
            @Option(names = {"-e", "--evalue_column"}, description = "Evalue column, default 11") Integer evalueColumn,
            @Option(names = {"-b", "--bitscore_column"}, description = "Bitscore column, default 12") Integer bitscoreColumn,
            @Option(names = {"-c", "--taxid_column"}, description = "Taxid column, default 13") Integer taxidColumn,
            @Option(names = {"-d", "--delimiter"}, description = "diamond (whitespace) or blast (tab), default diamond") String delimiter,
            @Option(names = {"-x", "--prefix"}, description = "Filename prefix for output files, default is the input file") String prefix,
            @Option(names = {"-v", "--verbose"}, description = "Also log hits skipped because of --taxid_skip") boolean verbose
    ) throws IOException {
        TaxonomyStore taxonomy = loadTaxonomy(path, nodesFile, namesFile, mergedFile, nodesDBFile);
        HGTParams.HGTParamsBuilder builder = buildParams(hitFile, prefix, ingroupTaxid, skipTaxid, queryColumn,
                subjectColumn, evalueColumn, bitscoreColumn, taxidColumn, delimiter)
                .useAlienIndex(useAlienIndex)
                .verbose(verbose);
        if (supportThreshold != null) {
            builder.supportThreshold(supportThreshold);
        }
        if (hUThreshold != null) {
            builder.hgtIndexThreshold(hUThreshold);
        }
        RunSummary summary = hgtAnalysis.run(builder.build(), taxonomy);
        log.info("{} HGT candidates written", summary.getCandidates());
        return 0;
    }

    @Command(name = "lineage", description = "Print the category and lineage of taxids")
    public int lineage(
            @Parameters(paramLabel = "TAXID", arity = "1..*", description = "NCBI taxids") int[] taxids,
            @Option(names = {"-p", "--path"}, description = "Directory containing nodes.dmp, names.dmp and optionally merged.dmp") String path,
            @Option(names = {"-o", "--nodes"}, description = "Path to nodes.dmp") String nodesFile,
            @Option(names = {"-a", "--names"}, description = "Path to names.dmp") String namesFile,
            @Option(names = {"-m", "--merged"}, description = "Path to merged.dmp") String mergedFile,
            @Option(names = {"-n", "--nodesDB"}, description = "nodesDB.txt file from blobtools") String nodesDBFile,
            @Option(names = {"-t", "--taxid_ingroup"}, description = "NCBI taxid to define 'ingroup', default 33208 (Metazoa)") Integer ingroupTaxid
    ) throws IOException {
        TaxonomyStore taxonomy = loadTaxonomy(path, nodesFile, namesFile, mergedFile, nodesDBFile);
        int threshold = ingroupTaxid == null ? GlobalConfig.getIntValue("hgt.taxid.threshold") : ingroupTaxid;
        LineageClassifier classifier = new LineageClassifier(taxonomy);
        out.println(String.join("\t", "#TAXID", "NAME", "RANK", "CATEGORY", "LINEAGE", "FULL_LINEAGE"));
        for (int taxid : taxids) {
            String category;
            String lineage;
            String fullLineage;
            try {
                category = classifier.classify(taxid, threshold).name();
                lineage = classifier.lineageToHighRank(taxid);
                fullLineage = classifier.lineageToSpecies(taxid);
            } catch (MalformedTaxonomyException e) {
                log.warn("taxid {}: {}", e.getTaxonId(), e.getMessage());
                category = "MALFORMED";
                lineage = LineageClassifier.UNDEF;
                fullLineage = LineageClassifier.UNDEF;
            }
            Optional<TaxonNode> node = taxonomy.node(taxid);
            out.println(String.join("\t", String.valueOf(taxid),
                    node.map(TaxonNode::getName).orElse(LineageClassifier.UNDEF),
                    node.map(TaxonNode::getRank).orElse(LineageClassifier.UNDEF),
                    category, lineage, fullLineage));
        }
        return 0;
    }

    @Command(name = "label-hits", description = "Label the hits of HGT candidates with _IN or _OUT")
    public int labelHits(
            @Option(names = {"-i", "--in"}, description = "HGT_candidates file", required = true) String candidatesFile,
            @Option(names = {"-r", "--diamond"}, description = "Taxified diamond/BLAST results file", required = true) String hitFile,
            @Option(names = {"-p", "--path"}, description = "Directory containing nodes.dmp, names.dmp and optionally merged.dmp") String path,
            @Option(names = {"-o", "--nodes"}, description = "Path to nodes.dmp") String nodesFile,
            @Option(names = {"-a", "--names"}, description = "Path to names.dmp") String namesFile,
            @Option(names = {"-m", "--merged"}, description = "Path to merged.dmp") String mergedFile,
            @Option(names = {"-n", "--nodesDB"}, description = "nodesDB.txt file from blobtools") String nodesDBFile,
            @Option(names = {"-t", "--taxid_ingroup"}, description = "NCBI taxid to define 'ingroup', default 33208 (Metazoa)") Integer ingroupTaxid,
            @Option(names = {"-q", "--query_column"}, description = "Query column, default 1") Integer queryColumn,
            @Option(names = {"-j", "--subject_column"}, description = "Subject column, default 2") Integer subjectColumn,
            @Option(names = {"-c", "--taxid_column"}, description = "Taxid column, default 13") Integer taxidColumn,
            @Option(names = {"-d", "--delimiter"}, description = "diamond (whitespace) or blast (tab), default diamond") String delimiter,
            @Option(names = {"-O", "--out"}, description = "Output file of labelled hits", required = true) String labelFile
    ) throws IOException {
        TaxonomyStore taxonomy = loadTaxonomy(path, nodesFile, namesFile, mergedFile, nodesDBFile);
        HGTParams params = buildParams(hitFile, null, ingroupTaxid, null, queryColumn, subjectColumn,
                null, null, taxidColumn, delimiter).build();
        hgtAnalysis.labelCandidateHits(Paths.get(candidatesFile), params, taxonomy, Paths.get(labelFile));
        return 0;
    }

    /**
     * Options that are not given keep the hgt.properties defaults.
     */
    private static HGTParams.HGTParamsBuilder buildParams(String hitFile,
                                                          String prefix,
                                                          Integer ingroupTaxid,
                                                          Integer skipTaxid,
                                                          Integer queryColumn,
                                                          Integer subjectColumn,
                                                          Integer evalueColumn,
                                                          Integer bitscoreColumn,
                                                          Integer taxidColumn,
                                                          String delimiter) {
        HGTParams.HGTParamsBuilder builder = HGTParams.builder()
                .hitFile(hitFile)
                .prefix(prefix);
        if (ingroupTaxid != null) {
            builder.thresholdTaxonId(ingroupTaxid);
        }
        if (skipTaxid != null) {
            builder.skipTaxonId(skipTaxid);
        }
        if (queryColumn != null) {
            builder.queryColumn(queryColumn);
        }
        if (subjectColumn != null) {
            builder.subjectColumn(subjectColumn);
        }
        if (evalueColumn != null) {
            builder.evalueColumn(evalueColumn);
        }
        if (bitscoreColumn != null) {
            builder.bitscoreColumn(bitscoreColumn);
        }
        if (taxidColumn != null) {
            builder.taxonColumn(taxidColumn);
        }
        if (delimiter != null) {
            builder.delimiter(HGTParams.Delimiter.of(delimiter));
        }
        return builder;
    }

    /**
     * A taxdump directory wins over separate dump files, which win over a nodesDB file.
     */
    static TaxonomyStore loadTaxonomy(String path,
                                      String nodesFile,
                                      String namesFile,
                                      String mergedFile,
                                      String nodesDBFile) throws IOException {
        if (path != null) {
            return TaxonomyLoader.fromDumpDirectory(Paths.get(path));
        } else if (nodesFile != null && namesFile != null) {
            return TaxonomyLoader.fromDumpFiles(Paths.get(nodesFile), Paths.get(namesFile),
                    mergedFile == null ? null : Paths.get(mergedFile));
        } else if (nodesDBFile != null) {
            return TaxonomyLoader.fromNodesDB(Paths.get(nodesDBFile));
        }
        throw new IllegalArgumentException("A taxonomy source is required: --path, --nodes with --names, or --nodesDB");
    }

    void setOut(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HGTCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        CommandLine.usage(this, out);
        return 0;
    }
}
