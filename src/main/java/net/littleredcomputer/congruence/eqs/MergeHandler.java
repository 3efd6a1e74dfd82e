package net.littleredcomputer.congruence.eqs;

/**
 * Observer of class merges in a {@link VarEqs}. All arguments are signed variables
 * (see {@link SignedVar}). newRoot is the surviving representative; oldRoot names the
 * absorbed representative, signed relative to newRoot. vNew and vOld are the signed
 * variables whose equality caused the merge, on the newRoot and oldRoot side respectively.
 * <p>
 * Calls are synchronous and never reentrant. Every onMerge is followed by exactly one
 * onMergeComplete, and merges are undone (onUnmerge) in strict LIFO order.
 */
public interface MergeHandler {
    /**
     * Called before the union-find relabels the members of oldRoot's class; both roots
     * are still independent representatives.
     */
    void onMerge(int newRoot, int oldRoot, int vNew, int vOld);

    /**
     * Called once every member of oldRoot's class resolves to newRoot.
     */
    void onMergeComplete(int newRoot, int oldRoot, int vNew, int vOld);

    /**
     * Called after the union-find has split a merge apart again.
     */
    void onUnmerge(int newRoot, int oldRoot);
}
