package dev.opportunityfeed.store;

import dev.opportunityfeed.entity.Opportunity;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.model.OpportunityType;

import java.util.Optional;

/**
 * The write path ingestion needs from storage. Both finders ignore soft-deleted records.
 */
public interface OpportunityStore {

    Optional<Opportunity> findByIdentity(String source, String sourceId);

    /**
     * Best non-deleted record of the same type whose company contains {@code company}
     * and whose title is similar enough to {@code title}.
     */
    Optional<Opportunity> findBySimilarity(String title, String company, OpportunityType type);

    Opportunity create(CandidateOpportunity candidate);

    Opportunity update(Opportunity existing, CandidateOpportunity candidate);
}
