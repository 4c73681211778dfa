package dev.opportunityfeed.service;

import dev.opportunityfeed.entity.Opportunity;
import dev.opportunityfeed.model.CandidateOpportunity;
import dev.opportunityfeed.normalize.OpportunityNormalizer;
import dev.opportunityfeed.store.OpportunityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Create-or-update against storage. A candidate matches an existing record by
 * (source, sourceId) first, then by same type, containing company and similar title.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationService {

    static final String PLACEHOLDER_DESCRIPTION = "No description provided.";

    private final OpportunityStore store;
    private final UpsertLocks locks;

    /**
     * Result of looking a candidate up in storage.
     */
    public record DuplicateResolution(Opportunity existing, boolean duplicate) {
        public static DuplicateResolution none() {
            return new DuplicateResolution(null, false);
        }

        public static DuplicateResolution of(Opportunity existing) {
            return new DuplicateResolution(existing, true);
        }
    }

    /**
     * Stored record after an upsert, and whether it was created by it.
     */
    public record UpsertResult(Opportunity record, boolean isNew) {
    }

    public DuplicateResolution resolve(CandidateOpportunity candidate) {
        if (candidate.hasSourceIdentity()) {
            Optional<Opportunity> byIdentity = store.findByIdentity(candidate.getSource(), candidate.getSourceId());
            if (byIdentity.isPresent()) {
                log.debug("'{}' matches record {} by identity", candidate.getTitle(), byIdentity.get().getId());
                return DuplicateResolution.of(byIdentity.get());
            }
        }

        if (fuzzyMatchable(candidate)) {
            Optional<Opportunity> similar = store.findBySimilarity(
                    candidate.getTitle(), candidate.getCompany(), candidate.getType());
            if (similar.isPresent()) {
                log.debug("'{}' matches record {} ('{}') by similarity", candidate.getTitle(),
                        similar.get().getId(), similar.get().getTitle());
                return DuplicateResolution.of(similar.get());
            }
        }
        return DuplicateResolution.none();
    }

    /**
     * Validate, then update the matching record or create a new one. Runs under the
     * candidate's identity and company/type locks.
     *
     * @throws CandidateValidationException when title or company is missing
     */
    public UpsertResult upsert(CandidateOpportunity candidate) {
        CandidateOpportunity validated = validate(candidate);

        return locks.withLocks(lockKeys(validated), () -> {
            DuplicateResolution resolution = resolve(validated);
            if (resolution.duplicate()) {
                return new UpsertResult(store.update(resolution.existing(), validated), false);
            }
            return new UpsertResult(store.create(validated), true);
        });
    }

    CandidateOpportunity validate(CandidateOpportunity candidate) {
        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(candidate.getTitle())) {
            missing.add("title");
        }
        if (StringUtils.isBlank(candidate.getCompany())) {
            missing.add("company");
        }
        if (!missing.isEmpty()) {
            throw new CandidateValidationException("Missing required fields " + missing
                    + " for candidate from " + candidate.getSource());
        }

        CandidateOpportunity.CandidateOpportunityBuilder builder = candidate.toBuilder()
                .title(StringUtils.left(candidate.getTitle().trim(), 200))
                .company(StringUtils.left(candidate.getCompany().trim(), 100))
                .location(StringUtils.left(
                        StringUtils.defaultIfBlank(candidate.getLocation(), OpportunityNormalizer.DEFAULT_LOCATION).trim(),
                        100))
                .salary(StringUtils.left(candidate.getSalary(), 50));
        if (StringUtils.isBlank(candidate.getDescription())) {
            builder.description(PLACEHOLDER_DESCRIPTION);
        }
        if (candidate.getType() == null) {
            builder.type(OpportunityNormalizer.classifyType(candidate.getTitle(), candidate.getDescription(),
                    candidate.getSource()));
        }
        return builder.build();
    }

    private boolean fuzzyMatchable(CandidateOpportunity candidate) {
        return candidate.hasTitle()
                && candidate.getType() != null
                && StringUtils.isNotBlank(candidate.getCompany())
                && !OpportunityNormalizer.UNKNOWN_COMPANY.equalsIgnoreCase(candidate.getCompany().trim());
    }

    private static List<String> lockKeys(CandidateOpportunity candidate) {
        List<String> keys = new ArrayList<>();
        if (candidate.hasSourceIdentity()) {
            keys.add("identity:" + candidate.getSource() + "|" + candidate.getSourceId());
        }
        keys.add("company:" + candidate.getCompany().toLowerCase(Locale.ROOT) + "|" + candidate.getType());
        return keys;
    }
}
