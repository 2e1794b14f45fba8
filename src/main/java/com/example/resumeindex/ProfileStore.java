package com.example.resumeindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Durable table of resume profiles keyed by external id.
 * <p>
 * Backfill selection and artifact lookup both order rows by ascending internal id. Index positions are
 * resolved to rows purely by that order, so the two must never diverge.
 */
@Service
public class ProfileStore {

    private static final Logger log = LoggerFactory.getLogger(ProfileStore.class);

    private final ResumeProfileRepository repo;
    private final ResumeProfileReader reader;
    private final Clock clock;

    public ProfileStore(ResumeProfileRepository repo, ResumeProfileReader reader, Clock clock) {
        this.repo = repo;
        this.reader = reader;
        this.clock = clock;
    }

    @Transactional
    public ResumeProfileRecord upsert(String externalId, ResumeProfile profile, String provenanceTag) {
        return upsert(externalId, profile, provenanceTag, null);
    }

    @Transactional
    public ResumeProfileRecord upsert(String externalId, ResumeProfile profile, String provenanceTag, String sourcePath) {
        if (externalId == null || externalId.isBlank()) {
            throw new ValidationException("External id must be a non-empty string.");
        }
        if (provenanceTag == null || provenanceTag.isBlank()) {
            throw new ValidationException("Provenance tag must be a non-empty string for " + externalId + ".");
        }
        if (profile == null) {
            throw new ValidationException("Profile payload is missing for " + externalId + ".");
        }
        String key = externalId.trim();
        String now = nowIso();
        ResumeProfileRecord r = repo.findByExternalId(key).orElse(null);
        boolean created = r == null;
        if (created) {
            r = new ResumeProfileRecord();
            r.setExternalId(key);
            r.setCreatedAt(now);
        }
        r.setSourcePath(sourcePath);
        r.setDisplayName(profile.getPersonalInformation() == null ? null : profile.getPersonalInformation().getFullName());
        r.setProfileJson(reader.toJson(profile));
        r.setProvenanceTag(provenanceTag.trim());
        r.setUpdatedAt(now);
        ResumeProfileRecord saved = repo.save(r);
        log.info("{} profile {} (id={}, provenance={})", created ? "Inserted" : "Updated", key, saved.getId(), saved.getProvenanceTag());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ResumeProfileRecord> selectForBackfill(BackfillMode mode) {
        if (mode == null) {
            throw new ConfigurationException("Backfill mode is required.");
        }
        switch (mode) {
            case MISSING:
                return repo.findByIndexArtifactPathIsNullOrderByIdAsc();
            case FULL:
            default:
                return repo.findAllByOrderByIdAsc();
        }
    }

    /**
     * Points exactly the given rows at {@code artifactRef}; every other row is left alone.
     *
     * @return number of rows updated, 0 for an empty id list
     */
    @Transactional
    public int attachIndexArtifact(Collection<Long> recordIds, String artifactRef) {
        if (recordIds == null || recordIds.isEmpty()) return 0;
        if (artifactRef == null || artifactRef.isBlank()) {
            throw new ValidationException("Artifact reference must be a non-empty string.");
        }
        List<Long> ids = new ArrayList<>(new LinkedHashSet<>(recordIds));
        int updated = repo.attachIndexArtifact(ids, artifactRef, nowIso());
        log.info("Attached {} of {} requested rows to {}", updated, ids.size(), artifactRef);
        return updated;
    }

    @Transactional(readOnly = true)
    public List<IndexedRow> lookupByArtifact(String artifactRef) {
        List<IndexedRow> out = new ArrayList<>();
        for (ResumeProfileRecord r : repo.findByIndexArtifactPathOrderByIdAsc(artifactRef)) {
            out.add(new IndexedRow(r.getId(), r.getExternalId(), r.getDisplayName()));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public ResumeProfileRecord findByExternalId(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            throw new ConfigurationException("External id must be a non-empty string.");
        }
        return repo.findByExternalId(externalId.trim())
                .orElseThrow(() -> new NotFoundException("No resume profile found for external id: " + externalId.trim()));
    }

    @Transactional(readOnly = true)
    public long count() {
        return repo.count();
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return repo.countByIndexArtifactPathIsNull();
    }

    private String nowIso() {
        return Instant.now(clock).toString();
    }

    /** Identity columns of a row that belongs to an index artifact. */
    public static class IndexedRow {
        private final long id;
        private final String externalId;
        private final String displayName;

        public IndexedRow(long id, String externalId, String displayName) {
            this.id = id;
            this.externalId = externalId;
            this.displayName = displayName;
        }

        public long getId() { return id; }
        public String getExternalId() { return externalId; }
        public String getDisplayName() { return displayName; }
    }
}
