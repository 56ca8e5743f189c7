package htnlint.invariant;

@FunctionalInterface
public interface InvariantCheck {

    /**
     * @return a message describing why the operator may violate the invariant, or null
     */
    String check(CheckContext context);
}
