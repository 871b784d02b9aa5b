package com.adpilot.marketing;

public enum CampaignAction {
    SCALE,
    PAUSE,
    OPTIMIZE,
    MAINTAIN
}
