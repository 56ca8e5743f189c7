package htnlint.diag;

/**
 * Diagnostic codes. Editors filter and suppress by these strings, so they never change meaning.
 */
public final class Codes {
    private Codes() {}

    // lexical
    public static final String LONE_COLON = "SYN001";
    public static final String UNEXPECTED_CHAR = "SYN002";
    public static final String UNTERMINATED_STRING = "SYN003";
    public static final String UNTERMINATED_QUOTED_ATOM = "SYN004";
    public static final String BAD_CUSTOM_VARIABLE = "SYN005";
    public static final String UNTERMINATED_COMMENT = "SYN015";

    // syntax
    public static final String EXPECTED_TOKEN = "SYN010";
    public static final String BRACKET_FOR_ARGS = "SYN011";
    public static final String UNEXPECTED_TOKEN = "SYN012";
    public static final String UNBALANCED_PARENS = "SYN013";
    public static final String UNBALANCED_BRACKETS = "SYN014";
    public static final String NESTING_TOO_DEEP = "SYN016";

    // variable binding
    public static final String UNBOUND_DO_VARIABLE = "VAR001";
    public static final String UNBOUND_ADD_VARIABLE = "VAR002";
    public static final String SINGLETON_VARIABLE = "VAR003";

    // HTN shape
    public static final String METHOD_WITH_EFFECTS = "HTN001";
    public static final String OPERATOR_WITH_DECOMPOSITION = "HTN002";
    public static final String MODIFIER_ON_OPERATOR = "HTN003";
    public static final String ELSE_WITHOUT_PREDECESSOR = "HTN004";
    public static final String EMPTY_DO = "HTN005";
    public static final String EMPTY_EFFECTS = "HTN006";

    // semantic
    public static final String UNDEFINED_TASK = "SEM001";
    public static final String UNDEFINED_PREDICATE = "SEM002";
    public static final String ARITY_MISMATCH = "SEM003";
    public static final String DEAD_METHOD = "SEM004";
    public static final String DEAD_OPERATOR = "SEM005";
    public static final String CALL_CYCLE = "SEM006";
    public static final String DUPLICATE_OPERATOR = "SEM007";

    // analyzer
    public static final String UNREACHABLE = "ANA001";
    public static final String RECURSION = "ANA002";
    public static final String INVARIANT_VIOLATION = "INV001";
}
