package tuftrust.model;

/**
 * A cryptographic signature with the signer's key identifier.
 * {@code isValid} is informational only; it is recomputed against the
 * current keys wherever a signature is reported and never trusted on input.
 */
public record Signature(
        String keyId,
        String method,
        byte[] signature,
        boolean isValid
) {
    public Signature {
        signature = signature.clone();
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }

    public Signature withValidity(boolean valid) {
        return new Signature(keyId, method, signature, valid);
    }
}
