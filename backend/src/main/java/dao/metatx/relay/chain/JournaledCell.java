package dao.metatx.relay.chain;

/**
 * Single journaled slot (owner, pause flag, counters).
 */
public final class JournaledCell<T> {

    private final StateJournal journal;
    private volatile T value;

    public JournaledCell(StateJournal journal, T initial) {
        this.journal = journal;
        this.value = initial;
    }

    public T get() {
        return value;
    }

    public void set(T next) {
        T previous = value;
        value = next;
        journal.record(() -> value = previous);
    }
}
