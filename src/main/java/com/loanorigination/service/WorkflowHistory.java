package com.loanorigination.service;

import com.loanorigination.model.WorkflowState;
import com.loanorigination.model.WorkflowTransition;

import java.util.List;

/**
 * Stage visits ordered by stage order, transitions in recording order.
 */
public record WorkflowHistory(
    ApplicationView application,
    List<WorkflowState> states,
    List<WorkflowTransition> transitions
) {
    public WorkflowHistory {
        states = List.copyOf(states);
        transitions = List.copyOf(transitions);
    }
}
