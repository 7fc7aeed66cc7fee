package info.acme.ordering.service.impl;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import info.acme.ordering.domain.Account;
import info.acme.ordering.exception.AccountNotFoundException;
import info.acme.ordering.exception.AccountNotRegisteredException;
import info.acme.ordering.exception.DuplicateAccountException;
import info.acme.ordering.exception.InvalidInputException;
import info.acme.ordering.identity.CallerIdentity;
import info.acme.ordering.repository.AccountRepository;
import info.acme.ordering.service.AccountService;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link AccountService} interface.
 */
@Service
@Slf4j
public class AccountServiceImpl implements AccountService {

    private final AccountRepository accountRepository;

    public AccountServiceImpl(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    /**
     * Creates an account after checking the email is not taken. A concurrent
     * registration of the same email is caught by the unique constraint and
     * reported the same way.
     */
    @Override
    @Transactional
    public Account createAccount(String name, String email) {
        if (name == null || name.isBlank() || email == null || email.isBlank()) {
            log.warn("Rejected account creation with missing name or email");
            throw new InvalidInputException("name and email are required to create an account");
        }

        if (accountRepository.existsByEmail(email)) {
            log.warn("Account with email {} already exists", email);
            throw new DuplicateAccountException(email);
        }

        try {
            Account account = accountRepository.saveAndFlush(Account.builder().name(name).email(email).build());
            log.info("Created account {} for email {}", account.getId(), email);

            return account;
        } catch (DataIntegrityViolationException e) {
            log.warn("Unique constraint rejected account for email {}: {}", email, e.getMessage());
            throw new DuplicateAccountException(email, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Account findAccountByEmail(String email) {
        log.debug("Attempting to find account by email {}", email);

        return accountRepository.findByEmail(email)
                .orElseThrow(() -> {
                    log.warn("Account not found for email {}", email);
                    return new AccountNotFoundException(email);
                });
    }

    @Override
    @Transactional(readOnly = true)
    public Account resolveCaller(CallerIdentity caller) {
        if (caller == null || !caller.hasEmail()) {
            log.warn("Request carries no caller email");
            throw new AccountNotRegisteredException();
        }

        return accountRepository.findByEmail(caller.getEmail())
                .orElseThrow(() -> {
                    log.warn("No account registered for caller {}", caller.getEmail());
                    return new AccountNotRegisteredException();
                });
    }
}
