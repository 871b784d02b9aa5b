package com.adpilot.worker;

public enum OptimizationAction {
    BUDGET_INCREASE,
    BUDGET_DECREASE,
    PAUSE,
    KEYWORD_OPTIMIZATION,
    BID_ADJUSTMENT
}
