package htnlint.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import htnlint.analysis.AnalysisResult;
import htnlint.diag.Diagnostic;
import htnlint.invariant.InvariantDefinition;
import htnlint.invariant.InvariantRegistry;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Renders analysis results, diagnostics and the invariant registry as snake_case JSON. */
public final class JsonReports {
    private JsonReports() {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /** The shared mapper; also used to read invariant configuration files. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(AnalysisResult result) {
        return write(result);
    }

    public static String toJson(List<Diagnostic> diagnostics) {
        return write(Map.of("diagnostics", diagnostics));
    }

    public static String toJson(InvariantRegistry registry) {
        List<InvariantDefinition> invariants = registry.list();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("invariants", invariants);
        out.put("categories", registry.categories());
        return write(out);
    }

    /** Batch output: one entry per file, in input order. */
    public static String toJson(Map<String, ?> perFile) {
        return write(perFile);
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
