package info.acme.ordering.exception;

/**
 * Thrown when the caller's identity has no matching account.
 */
public class AccountNotRegisteredException extends RuntimeException {
    public AccountNotRegisteredException() {
        super("account not registered");
    }
}
