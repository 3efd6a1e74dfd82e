package net.littleredcomputer.congruence;

import com.google.common.primitives.ImmutableIntArray;

import java.util.Objects;

/**
 * A monomial rewritten modulo the current equalities: the representatives of its factors,
 * sorted by variable, together with the product of their signs.
 */
public final class SignedVars {
    private final int var;  // the monomial variable this is a canonical form of
    private final ImmutableIntArray vars;
    private final boolean sign;  // true for negative

    SignedVars(int var, ImmutableIntArray vars, boolean sign) {
        this.var = var;
        this.vars = vars;
        this.sign = sign;
    }

    public int var() { return var; }
    public ImmutableIntArray vars() { return vars; }
    public int size() { return vars.length(); }
    public int get(int i) { return vars.get(i); }
    public boolean sign() { return sign; }
    public int rsign() { return sign ? -1 : 1; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignedVars)) return false;
        SignedVars that = (SignedVars) o;
        return var == that.var && sign == that.sign && vars.equals(that.vars);
    }

    @Override
    public int hashCode() { return Objects.hash(var, vars, sign); }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('v').append(var).append(" :=");
        if (sign) sb.append(" -");
        for (int i = 0; i < vars.length(); ++i) sb.append(" v").append(vars.get(i));
        return sb.toString();
    }
}
