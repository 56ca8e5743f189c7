package htnlint.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One clause of the source: a fact {@code head.}, or {@code head :- body.} classified by the
 * HTN clauses found in its body. Clause fields are null when the clause is absent.
 */
public record Rule(
        Term head,
        List<Term> body,
        int line,
        boolean isMethod,
        boolean isOperator,
        boolean isFact,
        boolean hasElse,
        boolean hasAllOf,
        boolean hasAnyOf,
        boolean hasHidden,
        Term ifClause,
        Term doClause,
        Term delClause,
        Term addClause
) {
    public Rule {
        Objects.requireNonNull(head, "head");
        body = List.copyOf(body);
    }

    public static Rule fact(Term head, int line) {
        return new Rule(head, List.of(), line, false, false, true,
                false, false, false, false, null, null, null, null);
    }

    public String key() {
        return head.key();
    }

    public String name() {
        return head.name();
    }

    /** Neither a method, an operator nor a fact: a plain Prolog rule. */
    public boolean isPredicate() {
        return !isMethod && !isOperator && !isFact;
    }

    public static final class Builder {
        private final Term head;
        private final int line;
        private final List<Term> body = new ArrayList<>();
        private boolean isMethod, isOperator;
        private boolean hasElse, hasAllOf, hasAnyOf, hasHidden;
        private Term ifClause, doClause, delClause, addClause;

        public Builder(Term head, int line) {
            this.head = head;
            this.line = line;
        }

        public Builder markElse() { hasElse = true; return this; }
        public Builder markAllOf() { hasAllOf = true; return this; }
        public Builder markAnyOf() { hasAnyOf = true; return this; }
        public Builder markHidden() { hasHidden = true; return this; }

        /** Appends a body term, recording it as an HTN clause when its functor is if/do/del/add. */
        public Builder addClause(Term term) {
            body.add(term);
            switch (term.name()) {
                case "if" -> { isMethod = true; ifClause = term; }
                case "do" -> { isMethod = true; doClause = term; }
                case "del" -> { isOperator = true; delClause = term; }
                case "add" -> { isOperator = true; addClause = term; }
                default -> { }
            }
            return this;
        }

        public Rule build() {
            return new Rule(head, body, line, isMethod, isOperator, false,
                    hasElse, hasAllOf, hasAnyOf, hasHidden, ifClause, doClause, delClause, addClause);
        }
    }
}
