package dao.metatx.relay.event;

import dao.metatx.relay.chain.StateJournal;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only log of emitted events. Events emitted inside a call that is rolled back are dropped
 * with it.
 */
@Slf4j
public class EventLog {

    private final StateJournal journal;
    private final List<LedgerEvent> events = new ArrayList<>();

    public EventLog(StateJournal journal) {
        this.journal = journal;
    }

    public synchronized void emit(LedgerEvent event) {
        events.add(event);
        int index = events.size() - 1;
        journal.record(() -> removeAt(index));
        log.debug("event {}", event);
    }

    public synchronized List<LedgerEvent> all() {
        return List.copyOf(events);
    }

    public synchronized <T extends LedgerEvent> List<T> ofType(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (LedgerEvent e : events) {
            if (type.isInstance(e)) out.add(type.cast(e));
        }
        return out;
    }

    public synchronized int size() {
        return events.size();
    }

    private synchronized void removeAt(int index) {
        events.remove(index);
    }
}
