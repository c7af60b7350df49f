package tuftrust.errors;

import java.util.List;

public class InvalidRootKeysException extends TrustException {

    private static final long serialVersionUID = 1L;

    private final List<String> keyIds;

    public InvalidRootKeysException(List<String> keyIds) {
        super("root keys unknown to key custody: " + keyIds);
        this.keyIds = List.copyOf(keyIds);
    }

    public List<String> keyIds() {
        return keyIds;
    }
}
