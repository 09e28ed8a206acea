package com.loanorigination.repository;

import com.loanorigination.model.LoanApplication;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;

import java.util.Map;
import java.util.Optional;

class LoanApplicationLockingRepositoryImpl implements LoanApplicationLockingRepository {

    private static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Optional<LoanApplication> findByIdForUpdate(String applicationId, long lockTimeoutMs) {
        return Optional.ofNullable(entityManager.find(LoanApplication.class, applicationId,
                LockModeType.PESSIMISTIC_WRITE, Map.of(LOCK_TIMEOUT_HINT, lockTimeoutMs)));
    }
}
