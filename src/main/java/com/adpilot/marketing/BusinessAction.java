package com.adpilot.marketing;

public enum BusinessAction {
    SCALE,
    PAUSE,
    OPTIMIZE,
    MAINTAIN,
    CLOSE
}
