package tuftrust.model;

import java.util.List;
import java.util.Optional;

/**
 * Name of a top-level role or a delegation.
 * Delegations live under {@code targets/}, one path segment per level:
 * {@code targets/releases} is delegated by {@code targets},
 * {@code targets/releases/qa} by {@code targets/releases}.
 */
public record RoleName(String value) {

    public static final RoleName ROOT = new RoleName("root");
    public static final RoleName TARGETS = new RoleName("targets");
    public static final RoleName SNAPSHOT = new RoleName("snapshot");
    public static final RoleName TIMESTAMP = new RoleName("timestamp");

    /** Top-level roles in registration order. */
    public static final List<RoleName> BASE_ROLES = List.of(ROOT, TARGETS, SNAPSHOT, TIMESTAMP);

    public RoleName {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("role name must not be empty");
        }
        if (!Util.isWellFormed(value)) {
            throw new IllegalArgumentException("role name is not well-formed unicode");
        }
    }

    public static RoleName of(String value) {
        return new RoleName(value);
    }

    public boolean isDelegation() {
        String prefix = TARGETS.value + "/";
        return value.startsWith(prefix)
                && value.length() > prefix.length()
                && !value.endsWith("/")
                && !value.contains("//");
    }

    /** Roles whose metadata lists targets: {@code targets} and every delegation. */
    public boolean signsTargets() {
        return equals(TARGETS) || isDelegation();
    }

    /** The role that declares this delegation; empty for top-level roles. */
    public Optional<RoleName> parent() {
        if (!isDelegation()) {
            return Optional.empty();
        }
        return Optional.of(new RoleName(value.substring(0, value.lastIndexOf('/'))));
    }

    /** Number of segments below {@code targets}; 0 for top-level roles. */
    public int depth() {
        if (!isDelegation()) {
            return 0;
        }
        return (int) value.chars().filter(c -> c == '/').count();
    }

    @Override
    public String toString() {
        return value;
    }
}
