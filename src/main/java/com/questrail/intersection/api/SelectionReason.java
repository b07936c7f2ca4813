package com.questrail.intersection.api;

/**
 * Why a lane was granted green in a decision cycle.
 */
public enum SelectionReason
{
    /** At least one lane reported emergency traffic. */
    EMERGENCY,

    /** The current green lane still had allotted time left. */
    HOLD,

    /** Demand and aging score among ordinary traffic. */
    FAIRNESS
}
