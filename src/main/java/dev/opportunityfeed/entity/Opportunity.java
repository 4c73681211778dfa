package dev.opportunityfeed.entity;

import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.model.OpportunityType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A stored opportunity. Rows created by ingestion carry {@code autoFetched=true};
 * rows are soft-deleted by administrators and never removed by the pipeline.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "opportunities", indexes = {
        @Index(name = "idx_source_identity", columnList = "source, source_id"),
        @Index(name = "idx_company_type", columnList = "company, type")
})
public class Opportunity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 100)
    private String company;

    @Column(nullable = false, length = 100)
    private String location;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private OpportunityType type;

    @Column(length = 50)
    private String category;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @Column(columnDefinition = "TEXT")
    private String requirements;

    @Column(length = 50)
    private String salary;

    private LocalDate deadline;

    @Column(name = "application_url", length = 500)
    private String applicationUrl;

    @Column(length = 50)
    private String source;

    @Column(name = "source_id")
    private String sourceId;

    @Column(name = "source_url", length = 500)
    private String sourceUrl;

    @Column(name = "auto_fetched", nullable = false)
    private boolean autoFetched;

    @Column(name = "last_fetched")
    private LocalDateTime lastFetched;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * New pipeline-owned record from a validated candidate.
     */
    public static Opportunity fromCandidate(CandidateOpportunity candidate) {
        LocalDateTime now = LocalDateTime.now();
        return Opportunity.builder()
                .title(candidate.getTitle())
                .company(candidate.getCompany())
                .location(candidate.getLocation())
                .type(candidate.getType() != null ? candidate.getType() : OpportunityType.JOB)
                .category(candidate.getCategory())
                .description(candidate.getDescription())
                .requirements(candidate.getRequirements())
                .salary(candidate.getSalary())
                .deadline(candidate.getDeadline())
                .applicationUrl(candidate.getApplicationUrl())
                .source(candidate.getSource())
                .sourceId(candidate.getSourceId())
                .sourceUrl(candidate.getSourceUrl())
                .autoFetched(true)
                .lastFetched(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Overwrites every field for which the candidate carries a non-empty value and refreshes
     * {@code lastFetched}. Identity, creation time and flags are left alone.
     */
    public Opportunity applyCandidate(CandidateOpportunity candidate) {
        if (hasText(candidate.getTitle())) title = candidate.getTitle();
        if (hasText(candidate.getCompany())) company = candidate.getCompany();
        if (hasText(candidate.getLocation())) location = candidate.getLocation();
        if (candidate.getType() != null) type = candidate.getType();
        if (hasText(candidate.getCategory())) category = candidate.getCategory();
        if (hasText(candidate.getDescription())) description = candidate.getDescription();
        if (hasText(candidate.getRequirements())) requirements = candidate.getRequirements();
        if (hasText(candidate.getSalary())) salary = candidate.getSalary();
        if (candidate.getDeadline() != null) deadline = candidate.getDeadline();
        if (hasText(candidate.getApplicationUrl())) applicationUrl = candidate.getApplicationUrl();
        if (hasText(candidate.getSource())) source = candidate.getSource();
        if (hasText(candidate.getSourceId())) sourceId = candidate.getSourceId();
        if (hasText(candidate.getSourceUrl())) sourceUrl = candidate.getSourceUrl();
        lastFetched = LocalDateTime.now();
        return this;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
