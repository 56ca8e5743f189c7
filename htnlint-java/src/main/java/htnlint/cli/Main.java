package htnlint.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Entry point of the {@code htnlint} command line.
 *
 * <pre>
 * htnlint lint file.htn...            syntax and semantic diagnostics
 * htnlint analyze file.htn... [-c]    call graph, reachability, cycles, invariants
 * htnlint batch dir [-p *.htn]        analyze every matching file under dir
 * htnlint invariants list|enable|disable|configure [id]
 * </pre>
 */
@Command(
        name = "htnlint",
        description = "Static analysis for HTN rule files",
        mixinStandardHelpOptions = true,
        version = "htnlint 0.1.0",
        subcommands = {
            LintCommand.class,
            AnalyzeCommand.class,
            BatchCommand.class,
            InvariantsCommand.class
        })
public final class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
    }
}
