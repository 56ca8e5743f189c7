package htnlint.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private static final String CLEAN = """
            goals(main()).
            at(u1, home).
            main() :- if(at(u1, home)), do(x()).
            x() :- del(at(u1, home)), add(at(u1, park)).
            """;

    @Test
    void lint_clean_file() throws IOException {
        Path file = write("clean.htn", CLEAN);
        assertEquals(0, run("lint", file.toString()));
        assertTrue(out.toString().contains("No issues found"));
        assertTrue(out.toString().contains("Total: 0 errors, 0 warnings"));
    }

    @Test
    void lint_error_sets_exit_code() throws IOException {
        Path file = write("bad.htn", "m() :- if(), do(missing()).");
        assertEquals(1, run("lint", file.toString()));
        assertTrue(out.toString().contains("E 1:17 [SEM001] Undefined method or operator: missing/0"));
    }

    @Test
    void lint_json_report() throws IOException {
        Path clean = write("clean.htn", CLEAN);
        Path bad = write("bad.htn", "m() :- if(), do(missing()).");
        assertEquals(1, run("lint", "--json", clean.toString(), bad.toString()));

        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertEquals(2, root.get("results").size());
        assertEquals(0, root.get("results").get(clean.toString()).get("error_count").asInt());
        assertEquals(1, root.get("total_errors").asInt());
    }

    @Test
    void lint_missing_file() {
        assertEquals(1, run("lint", dir.resolve("absent.htn").toString()));
        assertTrue(out.toString().contains("cannot read file"));
    }

    @Test
    void analyze_with_call_graph() throws IOException {
        Path file = write("game.htn", CLEAN);
        assertEquals(0, run("analyze", "--callgraph", file.toString()));
        String text = out.toString();
        assertTrue(text.contains("Goals: main/0"));
        assertTrue(text.contains("Call Graph:"));
        assertTrue(text.contains("main/0 (method) -> x/0"));
        assertTrue(text.contains("[Tile Capacity] x/0"));
    }

    @Test
    void analyze_honours_invariants_file() throws IOException {
        Path file = write("game.htn", CLEAN);
        Path config = write("invariants.json", "{\"tile_capacity\": {\"enabled\": false}}");
        assertEquals(0, run("analyze", "--json", "--invariants", config.toString(), file.toString()));

        JsonNode result = new ObjectMapper().readTree(out.toString()).get("results").get(file.toString());
        assertEquals(0, result.get("invariant_violations").size());
    }

    @Test
    void batch_analyzes_matching_files_in_order() throws IOException {
        write("b.htn", CLEAN);
        write("a.htn", "m() :- if(), do().");
        write("notes.txt", "not a rule file");
        assertEquals(0, run("batch", "--json", dir.toString()));

        JsonNode results = new ObjectMapper().readTree(out.toString()).get("results");
        assertEquals(2, results.size());
        assertEquals("a.htn", results.fieldNames().next());
    }

    @Test
    void batch_custom_pattern_and_empty_match() throws IOException {
        write("one.pl", "a.");
        assertEquals(0, run("batch", "--pattern", "*.pl", dir.toString()));
        assertTrue(out.toString().contains("Analysis: one.pl"));

        assertEquals(1, run("batch", "--pattern", "*.none", dir.toString()));
    }

    @Test
    void batch_rejects_missing_directory() {
        assertEquals(1, run("batch", dir.resolve("absent").toString()));
        assertTrue(err.toString().contains("Not a directory"));
    }

    @Test
    void no_subcommand_prints_usage() {
        assertEquals(0, run());
        assertTrue(out.toString().contains("Usage: htnlint"));
    }

    @Test
    void invariants_list() {
        assertEquals(0, run("invariants"));
        assertTrue(out.toString().contains("[ON] single_position: Single Position"));
        assertTrue(out.toString().contains("[OFF] delete_exists: Delete Exists"));
    }

    @Test
    void invariants_enable_persists_to_file() throws IOException {
        Path config = dir.resolve("invariants.json");
        assertEquals(0, run("invariants", "enable", "delete_exists", "--invariants", config.toString()));
        assertTrue(out.toString().contains("Invariant 'delete_exists' enabled"));

        JsonNode saved = new ObjectMapper().readTree(Files.readString(config));
        assertTrue(saved.get("delete_exists").get("enabled").asBoolean());
    }

    @Test
    void invariants_configure() throws IOException {
        Path config = dir.resolve("invariants.json");
        assertEquals(0, run("invariants", "configure", "tile_capacity", "--config", "{\"max_capacity\": 2}",
                "--invariants", config.toString()));
        JsonNode saved = new ObjectMapper().readTree(Files.readString(config));
        assertEquals(2, saved.get("tile_capacity").get("config").get("max_capacity").asInt());
    }

    @Test
    void invariants_errors() {
        assertEquals(1, run("invariants", "enable", "nope"));
        assertTrue(err.toString().contains("Unknown invariant: nope"));
        assertEquals(1, run("invariants", "disable"));
        assertEquals(1, run("invariants", "configure", "tile_capacity", "--config", "[1]"));
        assertTrue(err.toString().contains("--config must be a JSON object"));
    }

    @Test
    void configure_rejects_non_object_config() {
        assertEquals(1, run("invariants", "configure", "tile_capacity", "--config", "42"));
        assertEquals(1, run("invariants", "configure", "tile_capacity", "--config", "null"));
        assertTrue(err.toString().contains("ERROR: --config must be a JSON object"));
    }
}
