package com.loanorigination.model;

/**
 * Who drove a workflow transition.
 */
public enum TriggerType {
    AUTOMATIC,   // rule engine or system
    MANUAL       // employee action
}
