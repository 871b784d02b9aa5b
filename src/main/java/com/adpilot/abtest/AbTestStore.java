package com.adpilot.abtest;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of A/B tests. The default implementation is {@link JpaAbTestStore}; a host application can
 * replace it with its own bean.
 */
public interface AbTestStore {

    void insert(AbTest test);

    Optional<AbTest> findById(String testId);

    List<AbTest> findRunning();

    List<AbTest> findByCampaign(String campaignId);

    /**
     * Replaces the stored test with {@code updated} only while the stored status is {@code expected}.
     *
     * @return {@code false} when the test is missing or its status changed
     */
    boolean replaceIfStatus(AbTest updated, AbTestStatus expected);
}
