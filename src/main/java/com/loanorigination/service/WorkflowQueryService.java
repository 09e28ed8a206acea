package com.loanorigination.service;

import com.loanorigination.config.RedisConfig;
import com.loanorigination.exception.ApplicationNotFoundException;
import com.loanorigination.model.WorkflowState;
import com.loanorigination.model.StageStatus;
import com.loanorigination.repository.LoanApplicationRepository;
import com.loanorigination.repository.WorkflowStateRepository;
import com.loanorigination.repository.WorkflowTransitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Read side of the workflow. Transitions evict the cached view.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowQueryService {

    private final LoanApplicationRepository applicationRepository;
    private final WorkflowStateRepository stateRepository;
    private final WorkflowTransitionRepository transitionRepository;

    @Cacheable(value = RedisConfig.APPLICATIONS_CACHE, key = "#applicationId")
    @Transactional(readOnly = true)
    public ApplicationView getApplication(String applicationId) {
        log.debug("Loading application {} from database", applicationId);
        return applicationRepository.findById(applicationId)
                .map(ApplicationView::from)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
    }

    @Transactional(readOnly = true)
    public WorkflowHistory getWorkflowHistory(String applicationId) {
        ApplicationView application = applicationRepository.findById(applicationId)
                .map(ApplicationView::from)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));

        return new WorkflowHistory(
                application,
                stateRepository.findByApplicationIdOrderByStageOrderAsc(applicationId),
                transitionRepository.findByApplicationIdOrderByIdAsc(applicationId));
    }

    /**
     * The open stage visit, empty once the application reached a terminal stage.
     */
    @Transactional(readOnly = true)
    public Optional<WorkflowState> getActiveState(String applicationId) {
        return stateRepository
                .findByApplicationIdAndStatusNotOrderByStageOrderAsc(applicationId, StageStatus.COMPLETED)
                .stream()
                .reduce((first, second) -> second);
    }
}
