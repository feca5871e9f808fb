package com.challenges.treenav;

import ch.qos.logback.classic.Level;
import com.challenges.treenav.json.CriteriaParser;
import com.challenges.treenav.json.JsonChildren;
import com.challenges.treenav.json.JsonDocumentParser;
import com.challenges.treenav.json.JsonEntry;
import com.challenges.treenav.json.JsonNode;
import com.challenges.treenav.output.OutputFormatter;
import com.challenges.treenav.search.SearchCriteria;
import com.challenges.treenav.search.TreeSearch;
import com.challenges.treenav.tree.Tree;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "treenav", mixinStandardHelpOptions = true, version = "1.0",
         description = "Search JSON documents stage by stage with structural criteria")
public class TreeNav implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(TreeNav.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "CRITERIA",
                description = "One criteria per stage, e.g. 'name=items' 'type=object&name^=id'")
    private List<String> criteria;

    @Option(names = {"-i", "--input"}, description = "Input JSON file (default: stdin)")
    private File inputFile;

    @Option(names = "--first", description = "Depth-first search for the first entry matching a single criteria")
    private boolean first = false;

    @Option(names = "--children", description = "Match a single criteria against the root's direct children only")
    private boolean children = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in output")
    private boolean sortKeys = false;

    @Option(names = {"-n", "--with-names"}, description = "Prefix every result with the name it was found under")
    private boolean withNames = false;

    @Option(names = {"-v", "--verbose"}, description = "Log search progress to stderr")
    private boolean verbose = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TreeNav()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (first && children) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--first and --children are mutually exclusive");
        }
        if ((first || children) && criteria.size() != 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--first and --children take exactly one criteria");
        }
        if (verbose) {
            enableDebugLogging();
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            CriteriaParser criteriaParser = new CriteriaParser();
            MutableList<SearchCriteria<JsonEntry>> stages = Lists.mutable.empty();
            for (String expression : criteria) {
                stages.add(criteriaParser.parse(expression));
            }

            JsonEntry root = JsonEntry.root(readDocument());

            TreeSearch<JsonEntry> search = new TreeSearch<>(new JsonChildren());
            ImmutableList<JsonEntry> results;
            if (first) {
                Tree<JsonEntry> tree = search.buildTree(root);
                Optional<JsonEntry> match = search.firstMatch(tree, stages.getFirst());
                if (match.isPresent()) {
                    results = Lists.immutable.with(match.get());
                } else {
                    results = Lists.immutable.empty();
                }
            } else if (children) {
                results = search.directChildrenMatching(search.buildTree(root), stages.getFirst());
            } else {
                results = search.extractNodes(root, stages);
            }

            OutputFormatter formatter = new OutputFormatter(!compactOutput, sortKeys);
            for (JsonEntry result : results) {
                out.println(formatter.format(result, withNames));
            }
            out.flush();

            return 0;
        } catch (Exception e) {
            LOG.debug("Search failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private JsonNode readDocument() throws IOException {
        JsonDocumentParser parser = new JsonDocumentParser();
        if (inputFile == null) {
            return parser.parse(System.in);
        }
        try (InputStream input = Files.newInputStream(inputFile.toPath())) {
            return parser.parse(input);
        }
    }

    private static void enableDebugLogging() {
        Logger logger = LoggerFactory.getLogger("com.challenges.treenav");
        if (logger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
