package dev.opportunityfeed.repository;

import dev.opportunityfeed.entity.Opportunity;
import dev.opportunityfeed.model.OpportunityType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for stored opportunities. Every finder used by ingestion skips soft-deleted rows.
 */
@Repository
public interface OpportunityRepository extends JpaRepository<Opportunity, Long> {

    /**
     * Exact identity lookup.
     */
    Optional<Opportunity> findFirstBySourceAndSourceIdAndDeletedFalse(String source, String sourceId);

    /**
     * Fuzzy-match candidates: same type, company containing the given name (case-insensitive).
     * The name must already be escaped for LIKE with {@code !}.
     */
    @Query("SELECT o FROM Opportunity o WHERE o.deleted = false AND o.type = :type "
            + "AND LOWER(o.company) LIKE LOWER(CONCAT('%', :company, '%')) ESCAPE '!'")
    List<Opportunity> findSimilarityCandidates(@Param("company") String company,
                                               @Param("type") OpportunityType type);

    long countByDeletedFalse();

    List<Opportunity> findBySource(String source);
}
