package net.littleredcomputer.congruence;

import gnu.trove.list.array.TIntArrayList;

/**
 * For each variable, a cyclic singly-linked list of cells naming monomials in which the
 * variable's class occurs. Cells live in an arena and are addressed by int handles; the
 * arena only grows between scope pushes and is truncated when a scope is popped.
 * <p>
 * Each variable keeps the head and tail of its list. Merging the list of {@code other}
 * into that of {@code root} links the two cycles together without touching other's
 * head and tail, which is what allows {@link #split} to take them apart again exactly.
 * Inserts, removals, merges and splits must be undone in LIFO order.
 */
class UseLists {
    static final int NIL = -1;

    private final TIntArrayList cellNext = new TIntArrayList();
    private final TIntArrayList cellMonomial = new TIntArrayList();
    private final TIntArrayList head = new TIntArrayList();
    private final TIntArrayList tail = new TIntArrayList();

    private void ensure(int v) {
        while (head.size() <= v) {
            head.add(NIL);
            tail.add(NIL);
        }
    }

    int head(int v) { return v < head.size() ? head.getQuick(v) : NIL; }
    int tail(int v) { return v < tail.size() ? tail.getQuick(v) : NIL; }
    int next(int cell) { return cellNext.getQuick(cell); }
    int monomial(int cell) { return cellMonomial.getQuick(cell); }
    int cellCount() { return cellNext.size(); }
    int varCount() { return head.size(); }
    boolean isEmpty(int v) { return head(v) == NIL; }

    /**
     * Adds a cell for monomial index mIndex at the head of v's list.
     */
    void insert(int v, int mIndex) {
        ensure(v);
        final int c = cellNext.size();
        cellNext.add(head.getQuick(v));
        cellMonomial.add(mIndex);
        head.setQuick(v, c);
        if (tail.getQuick(v) == NIL) tail.setQuick(v, c);
        cellNext.setQuick(tail.getQuick(v), c);
    }

    /**
     * Unlinks the head cell of v's list. This is the inverse of the most recent insert on v.
     */
    void removeHead(int v) {
        final int h = head.getQuick(v), t = tail.getQuick(v);
        final int n = cellNext.getQuick(h);
        if (n == h) {
            head.setQuick(v, NIL);
            tail.setQuick(v, NIL);
        } else {
            head.setQuick(v, n);
            cellNext.setQuick(t, n);
        }
    }

    /**
     * Splices other's cycle in front of root's: other_head ... other_tail root_head ... root_tail.
     */
    void merge(int root, int other) {
        if (root == other) return;
        ensure(Math.max(root, other));
        final int otherHead = head.getQuick(other), otherTail = tail.getQuick(other);
        if (otherHead == NIL) return;
        final int rootHead = head.getQuick(root), rootTail = tail.getQuick(root);
        if (rootHead == NIL) {
            head.setQuick(root, otherHead);
            tail.setQuick(root, otherTail);
        } else {
            cellNext.setQuick(rootTail, otherHead);
            cellNext.setQuick(otherTail, rootHead);
            head.setQuick(root, otherHead);
        }
    }

    /**
     * Inverse of {@link #merge}: restores both cycles to their shape before the merge.
     */
    void split(int root, int other) {
        if (root == other) return;
        final int otherHead = head(other), otherTail = tail(other);
        if (otherHead == NIL) return;
        final int rootTail = tail.getQuick(root);
        if (rootTail == otherTail) {
            head.setQuick(root, NIL);
            tail.setQuick(root, NIL);
        } else {
            final int rootHead = cellNext.getQuick(otherTail);
            head.setQuick(root, rootHead);
            cellNext.setQuick(rootTail, rootHead);
            cellNext.setQuick(otherTail, otherHead);
        }
    }

    /**
     * Releases the cells allocated after the arena held mark cells. The caller has already
     * unlinked them.
     */
    void truncate(int mark) {
        if (mark >= cellNext.size()) return;
        cellNext.remove(mark, cellNext.size() - mark);
        cellMonomial.remove(mark, cellMonomial.size() - mark);
    }

    /**
     * @return the monomial indices on v's list, starting at its head
     */
    TIntArrayList monomialIndices(int v) {
        TIntArrayList out = new TIntArrayList();
        final int h = head(v);
        if (h == NIL) return out;
        int c = h;
        do {
            out.add(cellMonomial.getQuick(c));
            c = cellNext.getQuick(c);
        } while (c != h);
        return out;
    }
}
