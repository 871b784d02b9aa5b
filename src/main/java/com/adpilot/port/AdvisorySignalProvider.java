package com.adpilot.port;

/**
 * Optional second opinion on a business-level decision. It may only raise the confidence of a decision,
 * never change the action.
 */
public interface AdvisorySignalProvider {

    AdvisorySignal evaluate(AdvisoryRequest request);

    record AdvisoryRequest(
            String businessId,
            String proposedAction,
            int activeCampaigns,
            double averageScore,
            double averageRoas,
            long businessAgeDays) {
    }
}
