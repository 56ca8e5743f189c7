package htnlint.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import htnlint.invariant.InvariantDefinition;
import htnlint.invariant.InvariantRegistry;
import htnlint.io.InvariantConfigLoader;
import htnlint.io.JsonReports;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Locale;
import java.util.Map;

/**
 * Lists or changes the invariant registry. Changes only outlive the process when
 * {@code --invariants <file>} is given; the updated registry is then written back to that file.
 */
@Command(name = "invariants", description = "List, enable, disable or configure invariants")
final class InvariantsCommand extends HtnCommand {

    enum Action { LIST, ENABLE, DISABLE, CONFIGURE }

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {};

    @Parameters(index = "0", arity = "0..1", defaultValue = "LIST", description = "One of: ${COMPLETION-CANDIDATES}")
    Action action;

    @Parameters(index = "1", arity = "0..1", paramLabel = "ID", description = "Invariant id")
    String id;

    @Option(names = "--config", paramLabel = "<json>", description = "JSON object merged into the configuration")
    String config;

    @Override
    protected int execute() throws IOException {
        InvariantRegistry registry = invariantsFile != null && Files.notExists(invariantsFile)
                ? InvariantRegistry.withDefaults()
                : registry();

        if (action == Action.LIST) {
            list(registry);
            return OK;
        }
        if (id == null) {
            err().println("Missing invariant id for '" + action.name().toLowerCase(Locale.ROOT) + "'");
            return FAILED;
        }
        if (registry.get(id) == null) {
            err().println("Unknown invariant: " + id);
            return FAILED;
        }

        switch (action) {
            case ENABLE, DISABLE -> {
                boolean on = action == Action.ENABLE;
                registry.enable(id, on);
                report(Map.of("status", "updated"), "Invariant '" + id + "' " + (on ? "enabled" : "disabled"));
            }
            case CONFIGURE -> {
                if (config == null) {
                    err().println("Missing --config for 'configure'");
                    return FAILED;
                }
                registry.configure(id, parseConfig(config));
                report(Map.of("status", "configured"), "Invariant '" + id + "' configured");
            }
            default -> throw new IllegalStateException("Unhandled action " + action);
        }

        if (invariantsFile != null) InvariantConfigLoader.save(invariantsFile, registry);
        return OK;
    }

    private void list(InvariantRegistry registry) {
        if (json) {
            out().println(JsonReports.toJson(registry));
            return;
        }
        out().println();
        out().println(underline("Available Invariants:"));
        for (InvariantDefinition d : registry.list()) {
            out().println("  [" + (d.enabled() ? "ON" : "OFF") + "] " + d.id() + ": " + d.name());
            out().println("        " + d.description());
        }
    }

    private void report(Map<String, String> status, String text) {
        out().println(json ? JsonReports.toJson(status) : text);
    }

    private static Map<String, Object> parseConfig(String text) throws IOException {
        Map<String, Object> value;
        try {
            value = JsonReports.mapper().readValue(text, CONFIG_TYPE);
        } catch (MismatchedInputException e) {
            throw new IOException("--config must be a JSON object", e);
        }
        if (value == null) throw new IOException("--config must be a JSON object");
        return value;
    }
}
