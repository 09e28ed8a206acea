package com.loanorigination.repository;

import com.loanorigination.model.LoanApplication;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LoanApplicationRepository
        extends JpaRepository<LoanApplication, String>, LoanApplicationLockingRepository {

    Optional<LoanApplication> findByApplicationNumber(String applicationNumber);
}
