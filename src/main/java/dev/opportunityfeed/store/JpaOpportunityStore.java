package dev.opportunityfeed.store;

import dev.opportunityfeed.entity.Opportunity;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.model.OpportunityType;
import dev.opportunityfeed.repository.OpportunityRepository;
import dev.opportunityfeed.service.TitleSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link OpportunityStore} over Spring Data JPA.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaOpportunityStore implements OpportunityStore {

    private final OpportunityRepository repository;
    private final TitleSimilarity titleSimilarity;

    @Override
    @Transactional(readOnly = true)
    public Optional<Opportunity> findByIdentity(String source, String sourceId) {
        if (source == null || sourceId == null) {
            return Optional.empty();
        }
        return repository.findFirstBySourceAndSourceIdAndDeletedFalse(source, sourceId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Opportunity> findBySimilarity(String title, String company, OpportunityType type) {
        if (title == null || company == null || company.isBlank() || type == null) {
            return Optional.empty();
        }
        List<Opportunity> candidates = repository.findSimilarityCandidates(escapeLike(company.trim()), type);
        return titleSimilarity.bestMatch(title, candidates);
    }

    static String escapeLike(String value) {
        return value.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    @Override
    @Transactional
    public Opportunity create(CandidateOpportunity candidate) {
        Opportunity saved = repository.save(Opportunity.fromCandidate(candidate));
        log.debug("Created opportunity {} from {}", saved.getId(), candidate.getSource());
        return saved;
    }

    @Override
    @Transactional
    public Opportunity update(Opportunity existing, CandidateOpportunity candidate) {
        return repository.save(existing.applyCandidate(candidate));
    }
}
