package com.adpilot.port;

public record ExternalCampaign(String externalId, CampaignStatus status) {
}
