package info.acme.ordering.exception;

public class DuplicateAccountException extends RuntimeException {
    public DuplicateAccountException(String email) {
        super("Account with email " + email + " already exists");
    }

    public DuplicateAccountException(String email, Throwable cause) {
        super("Account with email " + email + " already exists", cause);
    }
}
