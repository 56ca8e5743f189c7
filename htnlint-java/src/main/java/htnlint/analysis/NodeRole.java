package htnlint.analysis;

import com.fasterxml.jackson.annotation.JsonValue;
import htnlint.ast.Rule;

import java.util.Locale;

public enum NodeRole {
    METHOD,
    OPERATOR,
    FACT,
    PREDICATE,
    GOAL;

    static NodeRole of(Rule rule) {
        if (rule.name().equals("goals")) return GOAL;
        if (rule.isMethod()) return METHOD;
        if (rule.isOperator()) return OPERATOR;
        if (rule.isFact()) return FACT;
        return PREDICATE;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
