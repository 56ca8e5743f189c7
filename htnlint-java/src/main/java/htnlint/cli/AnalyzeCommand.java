package htnlint.cli;

import htnlint.analysis.AnalysisResult;
import htnlint.analysis.Analyzer;
import htnlint.invariant.StateInvariant;
import htnlint.io.JsonReports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Command(name = "analyze", description = "Call graph, reachability, cycles and invariant checks")
final class AnalyzeCommand extends HtnCommand {
    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to analyze")
    List<Path> files;

    @Option(names = {"-c", "--callgraph"}, description = "Also print the call graph")
    boolean callGraph;

    @Override
    protected int execute() throws IOException {
        List<StateInvariant> invariants = registry().enabled();
        Map<String, Object> results = new LinkedHashMap<>();
        boolean failed = false;

        for (Path file : files) {
            String name = file.toString();
            try {
                AnalysisResult result = new Analyzer(Files.readString(file)).analyze(invariants);
                results.put(name, result);
                failed |= result.stats().get("errors") > 0;
                if (!json) printAnalysis(name, result, callGraph);
            } catch (IOException e) {
                log.debug("Cannot read {}", file, e);
                results.put(name, Map.of("error", String.valueOf(e.getMessage())));
                if (!json) out().println("ERROR: " + name + ": cannot read file");
                failed = true;
            }
        }

        if (json) out().println(JsonReports.toJson(Map.of("results", results)));
        return failed ? FAILED : OK;
    }
}
