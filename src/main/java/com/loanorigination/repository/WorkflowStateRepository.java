package com.loanorigination.repository;

import com.loanorigination.model.StageStatus;
import com.loanorigination.model.WorkflowState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkflowStateRepository extends JpaRepository<WorkflowState, Long> {

    List<WorkflowState> findByApplicationIdOrderByStageOrderAsc(String applicationId);

    /**
     * States still open for the application. At most one outside a transition.
     */
    List<WorkflowState> findByApplicationIdAndStatusNotOrderByStageOrderAsc(String applicationId,
                                                                            StageStatus status);

    @Query("SELECT COALESCE(MAX(s.stageOrder), 0) FROM WorkflowState s WHERE s.applicationId = :applicationId")
    int findMaxStageOrder(@Param("applicationId") String applicationId);
}
