package info.acme.ordering.service;

import info.acme.ordering.domain.Account;
import info.acme.ordering.identity.CallerIdentity;

public interface AccountService {
    /**
     * Registers a new account.
     *
     * @param name  The account holder's name.
     * @param email The account email, unique across accounts.
     * @return The created {@link Account}.
     * @throws InvalidInputException     if name or email is blank.
     * @throws DuplicateAccountException if an account with the email exists.
     */
    Account createAccount(String name, String email);

    /**
     * Finds an account by its email.
     *
     * @param email The email to look up.
     * @return The found account.
     * @throws AccountNotFoundException if no account has that email.
     */
    Account findAccountByEmail(String email);

    /**
     * Resolves the account a caller acts as.
     *
     * @param caller The caller identity.
     * @return The caller's account.
     * @throws AccountNotRegisteredException if the caller has no account.
     */
    Account resolveCaller(CallerIdentity caller);
}
