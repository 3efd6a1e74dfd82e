package net.littleredcomputer.congruence;

import java.util.ArrayList;
import java.util.List;

/**
 * A stack of undo actions. Undoing to a mark runs the actions recorded after it, most
 * recent first, which restores every structure they touched to its state at the mark.
 */
class Trail {
    private final List<Runnable> undo = new ArrayList<>();

    int size() { return undo.size(); }

    void push(Runnable action) { undo.add(action); }

    void undoTo(int mark) {
        if (mark > undo.size()) throw new IllegalStateException("trail mark " + mark + " is beyond the trail");
        while (undo.size() > mark) undo.remove(undo.size() - 1).run();
    }
}
