package tuftrust.errors;

public class UnknownDelegationException extends NotFoundException {

    private static final long serialVersionUID = 1L;

    public UnknownDelegationException(String delegation) {
        super("delegation", delegation);
    }
}
