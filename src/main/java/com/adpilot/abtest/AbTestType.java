package com.adpilot.abtest;

public enum AbTestType {
    BUDGET,
    CREATIVE,
    TARGETING,
    BIDDING
}
