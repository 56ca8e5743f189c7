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
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

@Command(name = "batch", description = "Analyze every matching file under a directory")
final class BatchCommand extends HtnCommand {
    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    @Parameters(index = "0", paramLabel = "DIR", description = "Directory to search")
    Path directory;

    @Option(names = {"-p", "--pattern"}, defaultValue = "*.htn",
            description = "File name glob (default: ${DEFAULT-VALUE})")
    String pattern;

    private record Outcome(Path file, AnalysisResult result, String error) {}

    @Override
    protected int execute() throws IOException {
        if (!Files.isDirectory(directory)) {
            err().println("Not a directory: " + directory);
            return FAILED;
        }
        List<Path> files = find(directory, pattern);
        if (files.isEmpty()) {
            if (json) out().println(JsonReports.toJson(Map.of("error", "No files found")));
            else out().println("No files matching " + pattern + " in " + directory);
            return FAILED;
        }
        log.info("Analyzing {} files under {}", files.size(), directory);

        List<StateInvariant> invariants = registry().enabled();
        List<Outcome> outcomes = files.parallelStream()
                .map(file -> analyze(file, invariants))
                .toList();

        Map<String, Object> results = new LinkedHashMap<>();
        boolean failed = false;
        for (Outcome o : outcomes) {
            String name = directory.relativize(o.file()).toString();
            if (o.error() != null) {
                results.put(name, Map.of("error", o.error()));
                if (!json) out().println("ERROR: " + name + ": " + o.error());
                failed = true;
                continue;
            }
            results.put(name, o.result());
            failed |= o.result().stats().get("errors") > 0;
            if (!json) printAnalysis(name, o.result(), false);
        }

        if (json) out().println(JsonReports.toJson(Map.of("results", results)));
        return failed ? FAILED : OK;
    }

    private static Outcome analyze(Path file, List<StateInvariant> invariants) {
        try {
            return new Outcome(file, new Analyzer(Files.readString(file)).analyze(invariants), null);
        } catch (IOException e) {
            log.debug("Cannot read {}", file, e);
            return new Outcome(file, null, "cannot read file");
        }
    }

    /** Regular files under {@code dir} whose name matches {@code glob}, sorted by path. */
    static List<Path> find(Path dir, String glob) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
