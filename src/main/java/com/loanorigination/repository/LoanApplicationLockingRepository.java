package com.loanorigination.repository;

import com.loanorigination.model.LoanApplication;

import java.util.Optional;

/**
 * Row-level locking for the application header.
 */
public interface LoanApplicationLockingRepository {

    /**
     * Read the application with a pessimistic write lock held until the
     * surrounding transaction ends. Waits at most {@code lockTimeoutMs}; a
     * lock that cannot be acquired surfaces as a
     * {@link org.springframework.dao.PessimisticLockingFailureException}.
     */
    Optional<LoanApplication> findByIdForUpdate(String applicationId, long lockTimeoutMs);
}
