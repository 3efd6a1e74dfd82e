package net.littleredcomputer.congruence;

import com.google.common.base.Joiner;
import com.google.common.primitives.ImmutableIntArray;

/**
 * The definition v := f_1 * f_2 * ... * f_k of a monomial variable v. Factors keep their
 * declared order and may repeat.
 */
public final class Monomial {
    private final int var;
    private final ImmutableIntArray factors;

    Monomial(int var, ImmutableIntArray factors) {
        this.var = var;
        this.factors = factors;
    }

    public int var() { return var; }
    public ImmutableIntArray factors() { return factors; }
    public int size() { return factors.length(); }
    public int factor(int i) { return factors.get(i); }

    @Override
    public String toString() {
        return "v" + var + " := v" + Joiner.on(" v").join(factors.asList());
    }
}
