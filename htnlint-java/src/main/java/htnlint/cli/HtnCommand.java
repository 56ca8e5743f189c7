package htnlint.cli;

import htnlint.analysis.AnalysisResult;
import htnlint.analysis.CallGraphNode;
import htnlint.analysis.InvariantViolation;
import htnlint.diag.Diagnostic;
import htnlint.diag.Severity;
import htnlint.invariant.InvariantRegistry;
import htnlint.io.InvariantConfigLoader;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Options and helpers shared by every subcommand. The exit code is 0 when no error diagnostic
 * was reported and 1 otherwise.
 */
abstract class HtnCommand implements Callable<Integer> {
    static final int OK = 0;
    static final int FAILED = 1;

    @Spec
    CommandSpec spec;

    @Option(names = {"-j", "--json"}, description = "Print JSON instead of text")
    boolean json;

    @Option(names = "--invariants", paramLabel = "<file>",
            description = "JSON file enabling, disabling or configuring invariants")
    Path invariantsFile;

    @Override
    public final Integer call() throws Exception {
        try {
            return execute();
        } catch (IOException e) {
            err().println("ERROR: " + e.getMessage());
            return FAILED;
        }
    }

    protected abstract int execute() throws Exception;

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /** A fresh registry with the defaults, updated from {@code --invariants} when given. */
    InvariantRegistry registry() throws IOException {
        InvariantRegistry registry = InvariantRegistry.withDefaults();
        if (invariantsFile != null) InvariantConfigLoader.apply(invariantsFile, registry);
        return registry;
    }

    static long count(List<Diagnostic> diagnostics, Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    static String format(Diagnostic d) {
        String prefix = switch (d.severity()) {
            case ERROR -> "E";
            case WARNING -> "W";
            case INFO -> "I";
        };
        return "  " + prefix + " " + d.line() + ":" + d.column() + " [" + d.code() + "] " + d.message();
    }

    void printAnalysis(String name, AnalysisResult result, boolean callGraph) {
        PrintWriter out = out();
        String rule = "=".repeat(60);
        out.println();
        out.println(rule);
        out.println("Analysis: " + name);
        out.println(rule);

        Map<String, Integer> stats = result.stats();
        out.println();
        out.println("Statistics:");
        out.println("  Methods:     " + stats.get("methods"));
        out.println("  Operators:   " + stats.get("operators"));
        out.println("  Facts:       " + stats.get("facts"));
        out.println("  Goals:       " + stats.get("goals"));
        out.println("  Reachable:   " + stats.get("reachable"));
        out.println("  Unreachable: " + stats.get("unreachable"));
        out.println("  Cycles:      " + stats.get("cycles"));

        if (!result.goals().isEmpty()) {
            out.println();
            out.println("Goals: " + String.join(", ", result.goals()));
        }
        if (!result.cycles().isEmpty()) {
            out.println();
            out.println("Cycles detected:");
            for (List<String> cycle : result.cycles()) out.println("  " + String.join(" -> ", cycle));
        }
        if (!result.unreachable().isEmpty()) {
            out.println();
            out.println("Unreachable code:");
            for (String key : result.unreachable()) out.println("  " + key);
        }
        if (!result.invariantViolations().isEmpty()) {
            out.println();
            out.println("Invariant violations:");
            for (InvariantViolation v : result.invariantViolations()) {
                out.println("  [" + v.invariant() + "] " + v.operator() + ": " + v.message());
            }
        }
        if (callGraph) {
            out.println();
            out.println("Call Graph:");
            for (CallGraphNode node : result.nodes().values()) {
                if (node.calls().isEmpty()) continue;
                out.println("  " + node.key() + " (" + node.role().label() + ") -> " + String.join(", ", node.calls()));
            }
        }
        if (!result.diagnostics().isEmpty()) {
            out.println();
            out.println("Diagnostics:");
            for (Diagnostic d : result.diagnostics()) out.println(format(d));
        }
    }

    static String underline(String title) {
        return title + System.lineSeparator() + "-".repeat(title.length());
    }
}
