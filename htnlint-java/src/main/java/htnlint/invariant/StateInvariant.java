package htnlint.invariant;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A registered invariant: its definition paired with the check logic. */
public record StateInvariant(InvariantDefinition definition, InvariantCheck check) {

    public StateInvariant {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(check, "check");
    }

    public static StateInvariant of(String id, String name, String description, String category,
                                    Map<String, Object> config, InvariantCheck check) {
        return new StateInvariant(new InvariantDefinition(id, name, description, category, true, config), check);
    }

    public String id() { return definition.id(); }
    public String name() { return definition.name(); }
    public boolean enabled() { return definition.enabled(); }

    /**
     * Runs the check against one operator's effects with this invariant's configuration.
     * Exceptions thrown by the check propagate to the caller.
     */
    public String checkOperator(String operatorName, List<String> deletes, List<String> adds,
                                List<String> initialFacts) {
        return check.check(new CheckContext(operatorName, deletes, adds, initialFacts, definition.config()));
    }

    StateInvariant withDefinition(InvariantDefinition updated) {
        return new StateInvariant(updated, check);
    }
}
