package tuftrust.changelist;

import tuftrust.model.Change;

import java.util.List;

/**
 * Ordered, append-only log of staged edits. List order is apply order.
 */
public interface Changelist {

    /**
     * Append a change. Only malformed changes (no scope or type) are rejected.
     */
    void add(Change change);

    /** Staged changes in append order. */
    List<Change> list();

    /** Drop every staged change. Called only after a successful publish or an explicit discard. */
    void clear();

    /**
     * Drop the first {@code count} changes, keeping anything appended after
     * them. Publish folds a prefix of the log while staging may continue.
     */
    void clearFirst(int count);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
