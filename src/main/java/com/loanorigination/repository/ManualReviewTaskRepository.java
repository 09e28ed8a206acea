package com.loanorigination.repository;

import com.loanorigination.model.ManualReviewTask;
import com.loanorigination.model.ReviewTaskStatus;
import com.loanorigination.model.ReviewType;
import com.loanorigination.model.Stage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ManualReviewTaskRepository extends JpaRepository<ManualReviewTask, Long> {

    Optional<ManualReviewTask> findByApplicationIdAndStage(String applicationId, Stage stage);

    List<ManualReviewTask> findByApplicationId(String applicationId);

    /**
     * Open tasks of one queue, most urgent first.
     */
    List<ManualReviewTask> findByReviewTypeAndStatusOrderByDueAtAsc(ReviewType reviewType, ReviewTaskStatus status);
}
