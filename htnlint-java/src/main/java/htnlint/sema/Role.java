package htnlint.sema;

import htnlint.ast.Rule;

public enum Role {
    METHOD,
    OPERATOR,
    FACT,
    PREDICATE;

    public static Role of(Rule rule) {
        if (rule.isMethod()) return METHOD;
        if (rule.isOperator()) return OPERATOR;
        if (rule.isFact()) return FACT;
        return PREDICATE;
    }
}
