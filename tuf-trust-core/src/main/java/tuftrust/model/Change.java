package tuftrust.model;

/**
 * One staged edit. Immutable once appended to a changelist.
 *
 * @param scope   the role whose metadata the edit belongs to
 * @param type    what is edited: {@link #TYPE_TARGET}, {@link #TYPE_DELEGATION},
 *                {@link #TYPE_ROLE} or {@link #TYPE_WITNESS}
 * @param path    the target name for target edits, empty otherwise
 * @param content encoded payload, see {@code tuftrust.changelist.ChangeCodec}
 */
public record Change(
        Action action,
        RoleName scope,
        String type,
        String path,
        byte[] content
) {
    public static final String TYPE_TARGET = "target";
    public static final String TYPE_DELEGATION = "delegation";
    public static final String TYPE_ROLE = "role";
    public static final String TYPE_WITNESS = "witness";

    public enum Action {
        CREATE, UPDATE, DELETE;

        public static Action fromString(String action) {
            return valueOf(action.trim().toUpperCase(java.util.Locale.ROOT));
        }
    }

    public Change {
        path = path == null ? "" : path;
        content = content == null ? new byte[0] : content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Change other
                && action == other.action
                && java.util.Objects.equals(scope, other.scope)
                && java.util.Objects.equals(type, other.type)
                && path.equals(other.path)
                && java.util.Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return java.util.Objects.hash(action, scope, type, path) * 31 + java.util.Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return action + " " + type + " " + scope + (path.isEmpty() ? "" : " " + path);
    }
}
