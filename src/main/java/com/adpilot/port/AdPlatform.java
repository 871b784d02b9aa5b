package com.adpilot.port;

public enum AdPlatform {
    GOOGLE_ADS,
    FACEBOOK_ADS,
    INSTAGRAM_ADS,
    LINKEDIN_ADS
}
