package info.acme.ordering.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import info.acme.ordering.domain.Account;

/**
 * Repository interface for managing {@link Account} entities.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {
    /**
     * Finds an account by its email.
     *
     * @param email the email to search for
     * @return an optional containing the account if found, or empty if not found
     */
    Optional<Account> findByEmail(String email);

    boolean existsByEmail(String email);
}
