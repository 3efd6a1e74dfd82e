package net.littleredcomputer.congruence.eqs;

/**
 * Signed variables are encoded as ints in the [2v|2v+1] style: the low bit is the sign
 * (1 means negated) and the remaining bits name the variable. Keeping them unboxed lets
 * the union-find and the monomial table store them in primitive collections.
 */
public final class SignedVar {
    private SignedVar() {}

    public static int pos(int var) { return 2 * var; }
    public static int neg(int var) { return 2 * var + 1; }
    public static int of(int var, boolean negated) { return negated ? neg(var) : pos(var); }
    public static int var(int sv) { return sv >> 1; }
    public static boolean negated(int sv) { return (sv & 1) != 0; }
    public static int not(int sv) { return sv ^ 1; }

    /**
     * @return sv with its sign flipped when negate is true
     */
    public static int xor(int sv, boolean negate) { return negate ? not(sv) : sv; }

    /**
     * Decodes a DIMACS-style signed integer (-4 is the negation of variable 4).
     */
    public static int fromInt(int literal) {
        return literal < 0 ? neg(-literal) : pos(literal);
    }

    public static String toString(int sv) {
        return (negated(sv) ? "-v" : "v") + var(sv);
    }
}
