package tuftrust.changelist;

import tuftrust.model.Change;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory changelist owned by one trust session.
 */
public class MemChangelist implements Changelist {

    private final List<Change> changes = new ArrayList<>();

    /**
     * Rebuild a changelist from changes reported elsewhere (e.g. a remote
     * snapshot). Goes through {@link #add} so both paths validate alike.
     */
    public static MemChangelist of(List<Change> changes) {
        MemChangelist cl = new MemChangelist();
        for (Change c : changes) {
            cl.add(c);
        }
        return cl;
    }

    @Override
    public synchronized void add(Change change) {
        if (change == null) {
            throw new IllegalArgumentException("change must not be null");
        }
        if (change.scope() == null) {
            throw new IllegalArgumentException("change has no scope: " + change);
        }
        if (change.type() == null || change.type().isEmpty()) {
            throw new IllegalArgumentException("change has no type: " + change);
        }
        if (change.action() == null) {
            throw new IllegalArgumentException("change has no action: " + change);
        }
        changes.add(change);
    }

    @Override
    public synchronized List<Change> list() {
        return List.copyOf(changes);
    }

    @Override
    public synchronized void clear() {
        changes.clear();
    }

    @Override
    public synchronized int size() {
        return changes.size();
    }

    @Override
    public synchronized void clearFirst(int count) {
        changes.subList(0, Math.min(count, changes.size())).clear();
    }
}
