package htnlint.cli;

import htnlint.diag.Diagnostic;
import htnlint.diag.Severity;
import htnlint.io.JsonReports;
import htnlint.sema.Linter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Command(name = "lint", description = "Report syntax and semantic problems")
final class LintCommand extends HtnCommand {
    private static final Logger log = LoggerFactory.getLogger(LintCommand.class);

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Files to lint")
    List<Path> files;

    @Override
    protected int execute() {
        Map<String, Object> results = new LinkedHashMap<>();
        long errors = 0;
        long warnings = 0;
        boolean failed = false;

        for (Path file : files) {
            String name = file.toString();
            List<Diagnostic> diagnostics;
            try {
                diagnostics = new Linter(Files.readString(file)).lint();
            } catch (IOException e) {
                log.debug("Cannot read {}", file, e);
                results.put(name, Map.of("error", String.valueOf(e.getMessage())));
                if (!json) out().println("ERROR: " + name + ": cannot read file");
                failed = true;
                continue;
            }

            long fileErrors = count(diagnostics, Severity.ERROR);
            long fileWarnings = count(diagnostics, Severity.WARNING);
            errors += fileErrors;
            warnings += fileWarnings;

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("diagnostics", diagnostics);
            entry.put("error_count", fileErrors);
            entry.put("warning_count", fileWarnings);
            results.put(name, entry);

            if (!json) print(name, diagnostics);
        }

        if (json) {
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("results", results);
            report.put("total_errors", errors);
            report.put("total_warnings", warnings);
            out().println(JsonReports.toJson(report));
        } else {
            out().println();
            out().println("Total: " + errors + " errors, " + warnings + " warnings");
        }
        return failed || errors > 0 ? FAILED : OK;
    }

    private void print(String name, List<Diagnostic> diagnostics) {
        out().println();
        out().println(underline(name));
        if (diagnostics.isEmpty()) {
            out().println("  No issues found");
            return;
        }
        for (Diagnostic d : diagnostics) out().println(format(d));
    }
}
