package com.adpilot.abtest;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Entity
@Table(name = "adpilot_ab_tests")
public class AbTestEntity {

    @Id
    @Column(name = "test_id")
    private String testId;

    @Column(name = "campaign_id", nullable = false)
    private String campaignId;

    @Enumerated(EnumType.STRING)
    @Column(name = "test_type", nullable = false)
    private AbTestType testType;

    @Enumerated(EnumType.STRING)
    @Column(name = "success_metric", nullable = false)
    private SuccessMetric successMetric;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AbTestStatus status;

    @Column(name = "duration_days", nullable = false)
    private int durationDays;

    @Column(name = "minimum_sample_size", nullable = false)
    private long minimumSampleSize;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private JsonNode variants;

    @Column(name = "statistical_significance")
    private Boolean statisticalSignificance;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "winning_variant_id")
    private String winningVariantId;

    @Column(name = "outcome_note", columnDefinition = "text")
    private String outcomeNote;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "concluded_at")
    private OffsetDateTime concludedAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    protected AbTestEntity() {
    }

    public AbTestEntity(String testId) {
        this.testId = testId;
    }

    public String getTestId() {
        return testId;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public void setCampaignId(String campaignId) {
        this.campaignId = campaignId;
    }

    public AbTestType getTestType() {
        return testType;
    }

    public void setTestType(AbTestType testType) {
        this.testType = testType;
    }

    public SuccessMetric getSuccessMetric() {
        return successMetric;
    }

    public void setSuccessMetric(SuccessMetric successMetric) {
        this.successMetric = successMetric;
    }

    public AbTestStatus getStatus() {
        return status;
    }

    public void setStatus(AbTestStatus status) {
        this.status = status;
    }

    public int getDurationDays() {
        return durationDays;
    }

    public void setDurationDays(int durationDays) {
        this.durationDays = durationDays;
    }

    public long getMinimumSampleSize() {
        return minimumSampleSize;
    }

    public void setMinimumSampleSize(long minimumSampleSize) {
        this.minimumSampleSize = minimumSampleSize;
    }

    public JsonNode getVariants() {
        return variants;
    }

    public void setVariants(JsonNode variants) {
        this.variants = variants;
    }

    public Boolean getStatisticalSignificance() {
        return statisticalSignificance;
    }

    public void setStatisticalSignificance(Boolean statisticalSignificance) {
        this.statisticalSignificance = statisticalSignificance;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public String getWinningVariantId() {
        return winningVariantId;
    }

    public void setWinningVariantId(String winningVariantId) {
        this.winningVariantId = winningVariantId;
    }

    public String getOutcomeNote() {
        return outcomeNote;
    }

    public void setOutcomeNote(String outcomeNote) {
        this.outcomeNote = outcomeNote;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(OffsetDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public OffsetDateTime getConcludedAt() {
        return concludedAt;
    }

    public void setConcludedAt(OffsetDateTime concludedAt) {
        this.concludedAt = concludedAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
