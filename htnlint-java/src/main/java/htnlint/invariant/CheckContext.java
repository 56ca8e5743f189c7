package htnlint.invariant;

import java.util.List;
import java.util.Map;

/**
 * What an invariant sees of one operator: its declared effects as rendered facts, the initial
 * facts of the source, and the invariant's own configuration. Built fresh for every check.
 */
public record CheckContext(
        String operatorName,
        List<String> deletes,
        List<String> adds,
        List<String> initialFacts,
        Map<String, Object> config
) {
    public CheckContext {
        deletes = List.copyOf(deletes);
        adds = List.copyOf(adds);
        initialFacts = List.copyOf(initialFacts);
        config = InvariantDefinition.freeze(config);
    }

    public String stringConfig(String key, String fallback) {
        Object v = config.get(key);
        return v == null ? fallback : v.toString();
    }

    public int intConfig(String key, int fallback) {
        Object v = config.get(key);
        if (v instanceof Number n) return n.intValue();
        return v == null ? fallback : Integer.parseInt(v.toString());
    }
}
