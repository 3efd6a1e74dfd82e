package net.littleredcomputer.congruence.eqs;

import com.google.common.base.Joiner;
import com.google.common.primitives.ImmutableIntArray;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;

/**
 * A set of constraint indices justifying a collection of equalities. Indices are kept
 * in the order they were first added; repeats are dropped.
 */
public class Explanation {
    private final TIntArrayList order = new TIntArrayList();
    private final TIntHashSet seen = new TIntHashSet();

    public void add(int constraint) {
        if (seen.add(constraint)) order.add(constraint);
    }

    public void addAll(ImmutableIntArray constraints) {
        constraints.forEach(this::add);
    }

    public boolean contains(int constraint) { return seen.contains(constraint); }
    public int size() { return order.size(); }
    public boolean isEmpty() { return order.isEmpty(); }
    public int[] toArray() { return order.toArray(); }

    @Override
    public String toString() {
        return "{" + Joiner.on(' ').join(ImmutableIntArray.copyOf(order.toArray()).asList()) + "}";
    }
}
