package dao.metatx.relay.chain;

import java.util.ArrayList;
import java.util.List;

/**
 * Undo log behind {@link LocalChain#transact}. Every journaled mutation registers the action that
 * restores the previous value; rolling back to a checkpoint replays those actions newest first.
 * <p>
 * Not thread-safe: callers hold the chain lock.
 */
public final class StateJournal {

    private final List<Runnable> undo = new ArrayList<>();
    private int depth;

    int begin() {
        depth++;
        return undo.size();
    }

    void release() {
        depth--;
        if (depth == 0) {
            undo.clear();
        }
    }

    void rollback(int checkpoint) {
        for (int i = undo.size() - 1; i >= checkpoint; i--) {
            undo.remove(i).run();
        }
        depth--;
    }

    /**
     * Outside a transaction there is nothing to roll back to, so the action is dropped.
     */
    public void record(Runnable undoAction) {
        if (depth > 0) {
            undo.add(undoAction);
        }
    }

    public boolean inTransaction() {
        return depth > 0;
    }

    public int depth() {
        return depth;
    }
}
