package com.adpilot.abtest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Stores tests in {@code adpilot_ab_tests}; variants are kept as a JSON array.
 */
public class JpaAbTestStore implements AbTestStore {

    private static final TypeReference<List<AbTestVariant>> VARIANT_LIST = new TypeReference<>() {
    };

    private final AbTestRepository repository;
    private final ObjectMapper objectMapper;

    public JpaAbTestStore(AbTestRepository repository, @Qualifier("adpilotObjectMapper") ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    public void insert(AbTest test) {
        if (repository.existsById(test.testId())) {
            throw new IllegalStateException("A/B test already exists: " + test.testId());
        }
        AbTestEntity entity = new AbTestEntity(test.testId());
        copy(test, entity);
        repository.save(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AbTest> findById(String testId) {
        return repository.findById(testId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AbTest> findRunning() {
        return repository.findByStatusOrderByStartedAtAsc(AbTestStatus.RUNNING).stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AbTest> findByCampaign(String campaignId) {
        return repository.findByCampaignIdOrderByStartedAtDesc(campaignId).stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    @Transactional
    public boolean replaceIfStatus(AbTest updated, AbTestStatus expected) {
        Optional<AbTestEntity> locked = repository.findByIdForUpdate(updated.testId());
        if (locked.isEmpty() || locked.get().getStatus() != expected) {
            return false;
        }
        AbTestEntity entity = locked.get();
        copy(updated, entity);
        repository.save(entity);
        return true;
    }

    private void copy(AbTest test, AbTestEntity entity) {
        entity.setCampaignId(test.campaignId());
        entity.setTestType(test.testType());
        entity.setSuccessMetric(test.successMetric());
        entity.setStatus(test.status());
        entity.setDurationDays(test.durationDays());
        entity.setMinimumSampleSize(test.minimumSampleSize());
        entity.setVariants(objectMapper.valueToTree(test.variants()));
        entity.setStatisticalSignificance(test.statisticalSignificance());
        entity.setConfidence(test.confidence());
        entity.setWinningVariantId(test.winningVariantId());
        entity.setOutcomeNote(test.outcomeNote());
        entity.setStartedAt(test.startedAt());
        entity.setConcludedAt(test.concludedAt());
        entity.setUpdatedAt(OffsetDateTime.now());
    }

    private AbTest toDomain(AbTestEntity entity) {
        JsonNode variants = entity.getVariants();
        List<AbTestVariant> parsed = variants == null ? List.of() : objectMapper.convertValue(variants, VARIANT_LIST);
        return new AbTest(
                entity.getTestId(),
                entity.getCampaignId(),
                entity.getTestType(),
                parsed,
                entity.getSuccessMetric(),
                entity.getDurationDays(),
                entity.getMinimumSampleSize(),
                entity.getStatus(),
                entity.getStatisticalSignificance(),
                entity.getConfidence(),
                entity.getWinningVariantId(),
                entity.getOutcomeNote(),
                entity.getStartedAt(),
                entity.getConcludedAt());
    }
}
