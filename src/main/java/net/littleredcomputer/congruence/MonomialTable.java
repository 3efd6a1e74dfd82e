package net.littleredcomputer.congruence;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.primitives.ImmutableIntArray;
import gnu.trove.impl.Constants;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import gnu.trove.set.hash.TIntHashSet;
import net.littleredcomputer.congruence.eqs.Explanation;
import net.littleredcomputer.congruence.eqs.MergeHandler;
import net.littleredcomputer.congruence.eqs.VarEqs;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import java.io.PrintStream;
import java.util.*;

import static net.littleredcomputer.congruence.eqs.SignedVar.negated;
import static net.littleredcomputer.congruence.eqs.SignedVar.var;

/**
 * A table of monomials v := f_1 * ... * f_k, kept canonical modulo the equalities of a
 * {@link VarEqs}. Monomials whose factors have the same representatives (up to sign) are
 * congruent; the table files each congruence class under its sorted representative
 * variables and links the members of a class on a ring.
 * <p>
 * The table binds itself as the merge handler of its VarEqs, and from then on the scopes
 * of the VarEqs must be pushed and popped only through {@link #pushScope} and
 * {@link #popScope}. Every change to the use lists and the congruence table made inside a
 * scope is recorded on a trail, so merges and declarations are undone exactly, in LIFO order.
 * <p>
 * Canonical forms are cached. Accessors that look read-only may recompute and store a
 * cached form. Not thread safe.
 */
public class MonomialTable implements MergeHandler {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final int NONE = -1;

    enum Trace {MERGE, CANONIZE, SCOPE}
    final EnumSet<Trace> tracing = EnumSet.noneOf(Trace.class);

    // Per-monomial state, parallel to monomials.
    private static class Node {
        SignedVars form;  // cached canonical form, meaningful when valid
        boolean valid = false;
        ImmutableIntArray key;  // the vars this monomial is filed under in the congruence table
        int next;  // ring of monomials filed under the same key
        int prev;
        int visited = 0;

        Node(int index) { next = prev = index; }
    }

    private final VarEqs ve;
    private final List<Monomial> monomials = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();
    private final TIntIntHashMap var2index = new TIntIntHashMap(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, NONE, NONE);
    private final UseLists useLists = new UseLists();
    private final TObjectIntHashMap<ImmutableIntArray> cgTable = new TObjectIntHashMap<>(Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, NONE);
    private final Trail trail = new Trail();
    private final TIntArrayList mergeMarks = new TIntArrayList();  // trail size at each merge made inside a scope
    private final TIntArrayList monomialLim = new TIntArrayList();
    private final TIntArrayList cellLim = new TIntArrayList();
    private final TIntArrayList trailLim = new TIntArrayList();
    private int visitStamp = 0;

    public MonomialTable(VarEqs ve) {
        if (ve.scopeDepth() != 0) throw new IllegalArgumentException("VarEqs must not have open scopes");
        this.ve = ve;
        ve.setMergeHandler(this);
    }

    // Nothing needs undoing at depth zero, since no pop can reach it.
    private void record(Runnable undo) {
        if (!trailLim.isEmpty()) trail.push(undo);
    }

    private int index(int v) {
        final int i = var2index.get(v);
        if (i == NONE) throw new IllegalArgumentException("v" + v + " is not a monomial variable");
        return i;
    }

    private int nextStamp() {
        if (++visitStamp == 0) {
            for (Node n : nodes) n.visited = 0;
            ++visitStamp;
        }
        return visitStamp;
    }

    private void checkDepth() {
        if (ve.scopeDepth() != trailLim.size()) {
            throw new IllegalStateException("scope depth " + trailLim.size() + " disagrees with VarEqs depth " + ve.scopeDepth());
        }
    }

    // ---- monomial store

    /**
     * Declares the monomial v := factors[0] * factors[1] * ...
     *
     * @throws IllegalArgumentException if v is already a monomial variable or there are no factors
     */
    public Monomial declare(int v, ImmutableIntArray factors) {
        if (isMonomialVariable(v)) throw new IllegalArgumentException("v" + v + " is already a monomial variable");
        if (factors.isEmpty()) throw new IllegalArgumentException("monomial v" + v + " has no factors");
        for (int i = 0; i < factors.length(); ++i) {
            if (factors.get(i) < 0) throw new IllegalArgumentException("negative variable in monomial v" + v);
        }
        final int idx = monomials.size();
        final Monomial m = new Monomial(v, factors);
        monomials.add(m);
        nodes.add(new Node(idx));
        var2index.put(v, idx);
        record(() -> var2index.remove(v));
        // One cell per distinct class, on the list of the class representative.
        TIntHashSet classes = new TIntHashSet();
        for (int i = 0; i < factors.length(); ++i) {
            final int r = var(ve.find(factors.get(i)));
            if (classes.add(r)) {
                useLists.insert(r, idx);
                record(() -> useLists.removeHead(r));
            }
        }
        insertCg(idx);
        if (tracing.contains(Trace.CANONIZE)) log.trace("declared %s as %s", m, nodes.get(idx).form);
        return m;
    }

    public Monomial declare(int v, int... factors) {
        return declare(v, ImmutableIntArray.copyOf(factors));
    }

    public boolean isMonomialVariable(int v) { return var2index.get(v) != NONE; }

    public Monomial monomialOf(int v) { return monomials.get(index(v)); }

    /**
     * @return the declared monomials, in declaration order
     */
    public List<Monomial> monomials() { return Collections.unmodifiableList(monomials); }

    public int size() { return monomials.size(); }

    // ---- canonical forms

    private SignedVars canonize(int idx) {
        final Node n = nodes.get(idx);
        if (n.valid) return n.form;
        final Monomial m = monomials.get(idx);
        final int[] vs = new int[m.size()];
        boolean sign = false;
        for (int i = 0; i < vs.length; ++i) {
            final int sv = ve.find(m.factor(i));
            vs[i] = var(sv);
            sign ^= negated(sv);
        }
        Arrays.sort(vs);
        n.form = new SignedVars(m.var(), ImmutableIntArray.copyOf(vs), sign);
        n.valid = true;
        if (tracing.contains(Trace.CANONIZE)) log.trace("canonize %s", n.form);
        return n.form;
    }

    public SignedVars canonicalFormOf(int v) { return canonize(index(v)); }

    public SignedVars canonicalFormOf(Monomial m) { return canonicalFormOf(m.var()); }

    /**
     * @return true if the canonical factors of v1 form a sub-multiset of those of v2, for
     * distinct monomials v1 and v2
     */
    public boolean divides(int v1, int v2) {
        if (v1 == v2) return false;
        final SignedVars s1 = canonicalFormOf(v1), s2 = canonicalFormOf(v2);
        final int n1 = s1.size(), n2 = s2.size();
        if (n1 > n2) return false;
        int i = 0, j = 0;
        while (true) {
            if (i == n1) return true;
            if (j == n2) return false;
            final int a = s1.get(i), b = s2.get(j);
            if (a == b) {
                ++i;
                ++j;
            } else if (a < b) {
                return false;
            } else {
                ++j;
            }
        }
    }

    public boolean divides(Monomial m1, Monomial m2) { return divides(m1.var(), m2.var()); }

    /**
     * Appends to sink the justifications of the equalities relating each factor of m to its
     * current representative.
     */
    public void explain(Monomial m, Explanation sink) {
        for (int i = 0; i < m.size(); ++i) {
            final int v = m.factor(i);
            final int r = var(ve.find(v));
            if (r != v) ve.explain(v, r, sink);
        }
    }

    public void explain(int v, Explanation sink) { explain(monomialOf(v), sink); }

    // ---- congruence table

    private void tablePut(ImmutableIntArray key, int v) {
        final int old = cgTable.put(key, v);
        record(() -> {
            if (old == NONE) cgTable.remove(key);
            else cgTable.put(key, old);
        });
    }

    private void tableRemove(ImmutableIntArray key) {
        final int old = cgTable.remove(key);
        record(() -> cgTable.put(key, old));
    }

    /**
     * Files monomial idx under its current canonical vars. If the key is taken, idx joins the
     * ring of the representative just before it; otherwise idx becomes the representative.
     */
    private void insertCg(int idx) {
        final Node n = nodes.get(idx);
        final SignedVars sv = canonize(idx);
        final ImmutableIntArray oldKey = n.key;
        n.key = sv.vars();
        record(() -> n.key = oldKey);
        final int rep = cgTable.get(n.key);
        if (rep == NONE) {
            tablePut(n.key, sv.var());
            return;
        }
        final int r = var2index.get(rep);
        final int last = nodes.get(r).prev;
        n.next = r;
        n.prev = last;
        nodes.get(r).prev = idx;
        nodes.get(last).next = idx;
        record(() -> {
            nodes.get(r).prev = last;
            nodes.get(last).next = r;
            n.next = idx;
            n.prev = idx;
        });
    }

    /**
     * Unfiles monomial idx, using the key it was filed under. A removed representative
     * hands its entry to the previous member of its ring.
     */
    private void removeCg(int idx) {
        final Node n = nodes.get(idx);
        final int next = n.next, prev = n.prev;
        if (cgTable.get(n.key) == monomials.get(idx).var()) {
            if (prev == idx) tableRemove(n.key);
            else tablePut(n.key, monomials.get(prev).var());
        }
        if (prev == idx) return;
        nodes.get(next).prev = prev;
        nodes.get(prev).next = next;
        n.next = n.prev = idx;
        record(() -> {
            nodes.get(next).prev = idx;
            nodes.get(prev).next = idx;
            n.next = next;
            n.prev = prev;
        });
    }

    /**
     * @return the canonical form of the representative of sv's congruence class
     */
    public SignedVars representativeOf(SignedVars sv) {
        return canonicalFormOf(cgTable.get(nodes.get(index(sv.var())).key));
    }

    /**
     * @return 1 if sv's monomial has the same sign as its representative, -1 otherwise
     */
    public int signRelativeToRepresentative(SignedVars sv) {
        return canonicalFormOf(sv.var()).sign() == representativeOf(sv).sign() ? 1 : -1;
    }

    /**
     * Looks up a congruence class by its vars, which need not be sorted.
     *
     * @return the canonical form of the class representative, if any monomial canonizes to vars
     */
    @CheckReturnValue
    public Optional<SignedVars> find(ImmutableIntArray vars) {
        final int[] key = vars.toArray();
        Arrays.sort(key);
        final int rep = cgTable.get(ImmutableIntArray.copyOf(key));
        return rep == NONE ? Optional.empty() : Optional.of(canonicalFormOf(rep));
    }

    @CheckReturnValue
    public Optional<SignedVars> find(int... vars) { return find(ImmutableIntArray.copyOf(vars)); }

    // ---- merge handling

    // The distinct monomials on the cells from head(r) through tail(r). After r's list has
    // been merged into another these are still contiguous, and they are exactly the
    // monomials mentioning r's former class.
    private TIntArrayList monomialsOnList(int r) {
        TIntArrayList out = new TIntArrayList();
        final int h = useLists.head(r);
        if (h == UseLists.NIL) return out;
        final int t = useLists.tail(r), stamp = nextStamp();
        for (int c = h; ; c = useLists.next(c)) {
            final Node n = nodes.get(useLists.monomial(c));
            if (n.visited != stamp) {
                n.visited = stamp;
                out.add(useLists.monomial(c));
            }
            if (c == t) break;
        }
        return out;
    }

    @Override
    public void onMerge(int newRoot, int oldRoot, int vNew, int vOld) {
        final int r2 = var(newRoot), r1 = var(oldRoot);
        if (!trailLim.isEmpty()) mergeMarks.add(trail.size());
        useLists.merge(r2, r1);
        record(() -> useLists.split(r2, r1));
    }

    @Override
    public void onMergeComplete(int newRoot, int oldRoot, int vNew, int vOld) {
        final int r1 = var(oldRoot);
        final TIntArrayList touched = monomialsOnList(r1);
        // All removals must precede all insertions: removal finds an entry by the key the
        // monomial was filed under, and an insertion may reuse that key for another monomial.
        for (int i = 0; i < touched.size(); ++i) removeCg(touched.getQuick(i));
        for (int i = 0; i < touched.size(); ++i) nodes.get(touched.getQuick(i)).valid = false;
        for (int i = 0; i < touched.size(); ++i) insertCg(touched.getQuick(i));
        if (tracing.contains(Trace.MERGE)) {
            log.trace("merged v%d into v%d; refiled %d monomials", r1, var(newRoot), touched.size());
        }
    }

    @Override
    public void onUnmerge(int newRoot, int oldRoot) {
        final int r1 = var(oldRoot);
        if (mergeMarks.isEmpty()) throw new IllegalStateException("unmerge of v" + r1 + " without a matching merge");
        trail.undoTo(mergeMarks.removeAt(mergeMarks.size() - 1));
        final TIntArrayList touched = monomialsOnList(r1);
        for (int i = 0; i < touched.size(); ++i) nodes.get(touched.getQuick(i)).valid = false;
        if (tracing.contains(Trace.MERGE)) {
            log.trace("unmerged v%d from v%d; invalidated %d monomials", r1, var(newRoot), touched.size());
        }
    }

    // ---- scopes

    public void pushScope() {
        checkDepth();
        monomialLim.add(monomials.size());
        cellLim.add(useLists.cellCount());
        trailLim.add(trail.size());
        ve.push();
        if (tracing.contains(Trace.SCOPE)) log.trace("push to depth %d", trailLim.size());
    }

    /**
     * Pops n scopes, undoing the merges and the declarations made in them.
     */
    public void popScope(int n) {
        checkDepth();
        if (n < 0 || n > trailLim.size()) {
            throw new IllegalArgumentException("cannot pop " + n + " scopes at depth " + trailLim.size());
        }
        if (n == 0) return;
        final int level = trailLim.size() - n;
        ve.pop(n);
        trail.undoTo(trailLim.getQuick(level));
        final int m = monomialLim.getQuick(level);
        monomials.subList(m, monomials.size()).clear();
        nodes.subList(m, nodes.size()).clear();
        useLists.truncate(cellLim.getQuick(level));
        monomialLim.remove(level, n);
        cellLim.remove(level, n);
        trailLim.remove(level, n);
        if (tracing.contains(Trace.SCOPE)) log.trace("pop %d to depth %d, %d monomials remain", n, level, m);
    }

    public int scopeDepth() { return trailLim.size(); }

    // ---- iteration

    /**
     * @return the distinct monomials in which the class of v occurs
     */
    public Iterable<Monomial> useListOf(int v) {
        return () -> new AbstractIterator<Monomial>() {
            private final TIntHashSet seen = new TIntHashSet();
            private int head = UseLists.NIL;
            private int cell = UseLists.NIL;
            private boolean started = false;

            @Override
            protected Monomial computeNext() {
                if (!started) {
                    started = true;
                    head = cell = useLists.head(var(ve.find(v)));
                }
                while (cell != UseLists.NIL) {
                    final int idx = useLists.monomial(cell);
                    cell = useLists.next(cell);
                    if (cell == head) cell = UseLists.NIL;
                    if (seen.add(idx)) return monomials.get(idx);
                }
                return endOfData();
            }
        };
    }

    /**
     * @return the monomials of which v's monomial is a proper factor, modulo current equalities
     */
    public Iterable<Monomial> properFactorsOf(int v) {
        final int idx = index(v);
        // Every multiple of v contains the first of v's canonical vars, so its use list suffices.
        return () -> Iterators.filter(useListOf(canonize(idx).get(0)).iterator(),
                c -> c.var() != v && divides(v, c.var()));
    }

    public Iterable<Monomial> properFactorsOf(Monomial m) { return properFactorsOf(m.var()); }

    /**
     * @return the monomials congruent to v's up to sign, starting with v's own
     */
    public Iterable<Monomial> signEquivalentMonomials(int v) {
        final int start = index(v);
        return () -> new AbstractIterator<Monomial>() {
            private int cur = start;
            private boolean done = false;

            @Override
            protected Monomial computeNext() {
                if (done) return endOfData();
                final Monomial m = monomials.get(cur);
                cur = nodes.get(cur).next;
                if (cur == start) done = true;
                return m;
            }
        };
    }

    public Iterable<Monomial> signEquivalentMonomials(Monomial m) { return signEquivalentMonomials(m.var()); }

    // ---- display

    public void display(PrintStream out) {
        for (Monomial m : monomials) {
            out.printf("%s  [%s]%n", m, canonicalFormOf(m));
        }
        for (int v = 0; v < useLists.varCount(); ++v) {
            if (useLists.isEmpty(v) || !ve.isRoot(v)) continue;
            StringBuilder sb = new StringBuilder();
            for (Monomial m : useListOf(v)) sb.append(" v").append(m.var());
            out.printf("use v%d:%s%n", v, sb);
        }
        for (int i = 0; i < monomials.size(); ++i) {
            final Node n = nodes.get(i);
            if (cgTable.get(n.key) != monomials.get(i).var()) continue;
            StringBuilder sb = new StringBuilder();
            for (Monomial m : signEquivalentMonomials(monomials.get(i).var())) sb.append(" v").append(m.var());
            out.printf("class %s:%s%n", n.key.asList(), sb);
        }
    }
}
