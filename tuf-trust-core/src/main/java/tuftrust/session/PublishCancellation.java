package tuftrust.session;

import tuftrust.errors.PublishCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets a caller abandon a publish in flight.
 * Publish polls it before signing and again before committing; a publish
 * cancelled at either point leaves no trace.
 */
public class PublishCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static PublishCancellation none() {
        return new PublishCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void checkpoint(String step) {
        if (cancelled.get()) {
            throw new PublishCancelledException(step);
        }
    }
}
