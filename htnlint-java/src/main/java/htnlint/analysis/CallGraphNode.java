package htnlint.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * A {@code name/arity} symbol of the call graph. {@code definitionCount} is 0 for a symbol that is
 * only referenced; {@code line} is then the first call site.
 */
public record CallGraphNode(
        String key,
        String name,
        int arity,
        @JsonProperty("type") NodeRole role,
        int line,
        int column,
        Set<String> calls,
        Set<String> calledBy,
        List<String> deletes,
        List<String> adds,
        List<String> conditions,
        boolean hasElse,
        @JsonProperty("has_allof") boolean hasAllOf,
        @JsonProperty("has_anyof") boolean hasAnyOf,
        int definitionCount
) {
    @JsonIgnore
    public boolean isDefined() {
        return definitionCount > 0;
    }
}
