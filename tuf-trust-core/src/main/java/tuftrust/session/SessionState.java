package tuftrust.session;

/**
 * Lifecycle of a trust session.
 * {@code UNINITIALIZED → INITIALIZED → STAGING* → PUBLISHING → INITIALIZED},
 * with {@code FAILED} reachable only from {@code PUBLISHING}.
 */
public enum SessionState {
    UNINITIALIZED,
    INITIALIZED,
    STAGING,
    PUBLISHING,
    FAILED
}
