package tuftrust.model;

/**
 * Globally unique name of one trust collection, e.g. {@code docker.io/library/alpine}.
 */
public record Gun(String value) {

    public Gun {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("GUN must not be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
