package com.loanorigination.repository;

import com.loanorigination.model.WorkflowTransition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkflowTransitionRepository extends JpaRepository<WorkflowTransition, Long> {

    /**
     * Transitions in the order they were recorded.
     */
    List<WorkflowTransition> findByApplicationIdOrderByIdAsc(String applicationId);

    long countByApplicationId(String applicationId);
}
