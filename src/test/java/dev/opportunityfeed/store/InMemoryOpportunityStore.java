package dev.opportunityfeed.store;

import dev.opportunityfeed.entity.Opportunity;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.model.OpportunityType;
import dev.opportunityfeed.service.TitleSimilarity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed store with the same matching rules as the JPA store.
 */
public class InMemoryOpportunityStore implements OpportunityStore {

    private final Map<Long, Opportunity> records = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final TitleSimilarity titleSimilarity;

    public InMemoryOpportunityStore(TitleSimilarity titleSimilarity) {
        this.titleSimilarity = titleSimilarity;
    }

    @Override
    public Optional<Opportunity> findByIdentity(String source, String sourceId) {
        return records.values().stream()
                .filter(o -> !o.isDeleted())
                .filter(o -> source != null && source.equals(o.getSource()))
                .filter(o -> sourceId != null && sourceId.equals(o.getSourceId()))
                .findFirst();
    }

    @Override
    public Optional<Opportunity> findBySimilarity(String title, String company, OpportunityType type) {
        String needle = company.trim().toLowerCase(Locale.ROOT);
        List<Opportunity> candidates = records.values().stream()
                .filter(o -> !o.isDeleted())
                .filter(o -> o.getType() == type)
                .filter(o -> o.getCompany().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
        return titleSimilarity.bestMatch(title, candidates);
    }

    @Override
    public Opportunity create(CandidateOpportunity candidate) {
        Opportunity opportunity = Opportunity.fromCandidate(candidate);
        opportunity.setId(ids.incrementAndGet());
        records.put(opportunity.getId(), opportunity);
        return opportunity;
    }

    @Override
    public Opportunity update(Opportunity existing, CandidateOpportunity candidate) {
        Opportunity updated = existing.applyCandidate(candidate);
        records.put(updated.getId(), updated);
        return updated;
    }

    public List<Opportunity> all() {
        return new ArrayList<>(records.values());
    }

    public int size() {
        return records.size();
    }
}
