package htnlint.sema;

/** One definition of a {@code name/arity} symbol. */
public record SymbolInfo(String name, int arity, int line, int column, Role role) {

    public String key() {
        return name + "/" + arity;
    }
}
