package net.littleredcomputer.congruence.eqs;

import com.google.common.primitives.ImmutableIntArray;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntIntHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

import static net.littleredcomputer.congruence.eqs.SignedVar.*;

/**
 * A union-find structure over variables which also tracks sign: each class has a root
 * variable, and every member records whether it equals the root or its negation.
 * <p>
 * find is O(1): instead of compressing paths, a merge relabels every member of the smaller
 * class (ties go against the first argument of {@link #merge}). The members of a class are
 * kept on a cyclic list threaded through {@code next}; merging two classes exchanges the
 * successors of their roots, and exchanging them again undoes the merge. Merges are undone
 * in LIFO order when scopes are popped.
 * <p>
 * Each merge is recorded as an edge labeled with its justification. The edges form a
 * spanning forest of the classes, so any two equivalent variables are connected by exactly
 * one path, which {@link #explain} reports.
 */
public class VarEqs {
    private static final Logger log = LogManager.getFormatterLogger();

    private final TIntArrayList root = new TIntArrayList();
    private final TIntArrayList parity = new TIntArrayList();  // 1 if the variable equals -root
    private final TIntArrayList next = new TIntArrayList();  // cyclic list of class members
    private final TIntArrayList size = new TIntArrayList();  // meaningful for roots only

    // The k-th entry of each of these describes the k-th merge still in effect.
    private final TIntArrayList oldRoots = new TIntArrayList();
    private final TIntArrayList newRoots = new TIntArrayList();
    private final TIntArrayList relSign = new TIntArrayList();
    private final TIntArrayList edgeU = new TIntArrayList();
    private final TIntArrayList edgeW = new TIntArrayList();
    private final List<ImmutableIntArray> edgeJustification = new ArrayList<>();
    private final List<TIntArrayList> adjacent = new ArrayList<>();  // variable -> merge indices

    private final TIntArrayList lim = new TIntArrayList();  // merge count at each push
    private MergeHandler handler = null;

    /**
     * Binds the observer notified of merges. Only one handler may ever be bound.
     */
    public void setMergeHandler(MergeHandler h) {
        if (handler != null && handler != h) throw new IllegalStateException("a merge handler is already bound");
        handler = h;
    }

    private void ensure(int v) {
        if (v < 0) throw new IllegalArgumentException("negative variable: " + v);
        for (int u = root.size(); u <= v; ++u) {
            root.add(u);
            parity.add(0);
            next.add(u);
            size.add(1);
            adjacent.add(new TIntArrayList());
        }
    }

    /**
     * @return the representative of v's class, signed so that v equals it
     */
    public int find(int v) {
        if (v >= root.size()) return pos(v);
        return of(root.getQuick(v), parity.getQuick(v) != 0);
    }

    /**
     * @return the representative of the class of the signed variable sv, signed so that sv equals it
     */
    public int findSigned(int sv) {
        return SignedVar.xor(find(var(sv)), negated(sv));
    }

    public boolean isRoot(int v) { return var(find(v)) == v; }

    public boolean areEquivalent(int u, int w) { return var(find(u)) == var(find(w)); }

    public int classSize(int v) {
        int r = var(find(v));
        return r < size.size() ? size.getQuick(r) : 1;
    }

    /**
     * Records the equality a = b between signed variables.
     *
     * @param justification indices of the constraints implying the equality
     * @return true if two classes were merged, false if a and b were already in one class
     *         (when the signs disagree the equality is ignored)
     */
    public boolean merge(int a, int b, ImmutableIntArray justification) {
        ensure(Math.max(var(a), var(b)));
        int fa = findSigned(a);
        int fb = findSigned(b);
        if (var(fa) == var(fb)) {
            if (fa != fb) log.debug("ignoring %s = %s: their class already equates them with opposite signs",
                    SignedVar.toString(a), SignedVar.toString(b));
            return false;
        }
        if (size.getQuick(var(fa)) > size.getQuick(var(fb))) {
            int t = a; a = b; b = t;
            t = fa; fa = fb; fb = t;
        }
        final int r1 = var(fa), r2 = var(fb);
        final int rel = (negated(fa) ^ negated(fb)) ? 1 : 0;  // r1 = (-1)^rel * r2
        final int newRoot = pos(r2), oldRoot = of(r1, rel != 0);
        log.trace("merge %s into %s because %s = %s", SignedVar.toString(oldRoot), SignedVar.toString(newRoot),
                SignedVar.toString(a), SignedVar.toString(b));
        if (handler != null) handler.onMerge(newRoot, oldRoot, b, a);
        int u = r1;
        do {
            root.setQuick(u, r2);
            parity.setQuick(u, parity.getQuick(u) ^ rel);
            u = next.getQuick(u);
        } while (u != r1);
        swapNext(r1, r2);
        size.setQuick(r2, size.getQuick(r2) + size.getQuick(r1));

        final int k = oldRoots.size();
        oldRoots.add(r1);
        newRoots.add(r2);
        relSign.add(rel);
        edgeU.add(var(a));
        edgeW.add(var(b));
        edgeJustification.add(justification);
        adjacent.get(var(a)).add(k);
        adjacent.get(var(b)).add(k);
        if (handler != null) handler.onMergeComplete(newRoot, oldRoot, b, a);
        return true;
    }

    public boolean merge(int a, int b, int... justification) {
        return merge(a, b, ImmutableIntArray.copyOf(justification));
    }

    private void swapNext(int u, int w) {
        int t = next.getQuick(u);
        next.setQuick(u, next.getQuick(w));
        next.setQuick(w, t);
    }

    private void undoMerge() {
        final int k = oldRoots.size() - 1;
        final int r1 = oldRoots.getQuick(k), r2 = newRoots.getQuick(k), rel = relSign.getQuick(k);
        swapNext(r1, r2);
        int u = r1;
        do {
            root.setQuick(u, r1);
            parity.setQuick(u, parity.getQuick(u) ^ rel);
            u = next.getQuick(u);
        } while (u != r1);
        size.setQuick(r2, size.getQuick(r2) - size.getQuick(r1));

        // The edge of the most recent merge is the last one on both of its endpoints' lists.
        TIntArrayList au = adjacent.get(edgeU.getQuick(k)), aw = adjacent.get(edgeW.getQuick(k));
        au.removeAt(au.size() - 1);
        aw.removeAt(aw.size() - 1);
        oldRoots.removeAt(k);
        newRoots.removeAt(k);
        relSign.removeAt(k);
        edgeU.removeAt(k);
        edgeW.removeAt(k);
        edgeJustification.remove(k);
        log.trace("unmerge v%d from v%d", r1, r2);
        if (handler != null) handler.onUnmerge(pos(r2), of(r1, rel != 0));
    }

    public void push() {
        lim.add(oldRoots.size());
    }

    /**
     * Undoes every merge performed since the n-th most recent push.
     */
    public void pop(int n) {
        if (n < 0 || n > lim.size()) {
            throw new IllegalArgumentException("cannot pop " + n + " scopes at depth " + lim.size());
        }
        if (n == 0) return;
        final int level = lim.size() - n;
        final int mark = lim.getQuick(level);
        while (oldRoots.size() > mark) undoMerge();
        lim.remove(level, n);
    }

    public int scopeDepth() { return lim.size(); }

    /**
     * Appends to sink the justifications of the merges connecting variables u and w.
     *
     * @throws IllegalArgumentException if u and w are not in the same class
     */
    public void explain(int u, int w, Explanation sink) {
        if (u == w) return;
        if (!areEquivalent(u, w)) {
            throw new IllegalArgumentException("v" + u + " and v" + w + " are not equivalent");
        }
        // Breadth-first search over the merge forest, remembering the edge used to reach each variable.
        TIntIntHashMap via = new TIntIntHashMap();
        TIntArrayList queue = new TIntArrayList();
        queue.add(u);
        via.put(u, -1);
        for (int h = 0; h < queue.size(); ++h) {
            final int x = queue.getQuick(h);
            if (x == w) break;
            TIntArrayList edges = adjacent.get(x);
            for (int i = 0; i < edges.size(); ++i) {
                final int e = edges.getQuick(i);
                final int y = edgeU.getQuick(e) == x ? edgeW.getQuick(e) : edgeU.getQuick(e);
                if (!via.containsKey(y)) {
                    via.put(y, e);
                    queue.add(y);
                }
            }
        }
        for (int x = w; x != u; ) {
            final int e = via.get(x);
            sink.addAll(edgeJustification.get(e));
            x = edgeU.getQuick(e) == x ? edgeW.getQuick(e) : edgeU.getQuick(e);
        }
    }
}
