package com.adpilot.abtest;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AbTestRepository extends JpaRepository<AbTestEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM AbTestEntity t WHERE t.testId = :testId")
    Optional<AbTestEntity> findByIdForUpdate(@Param("testId") String testId);

    List<AbTestEntity> findByStatusOrderByStartedAtAsc(AbTestStatus status);

    List<AbTestEntity> findByCampaignIdOrderByStartedAtDesc(String campaignId);
}
