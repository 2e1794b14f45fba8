package com.example.resumeindex;

import org.springframework.web.bind.annotation.*;

/**
 * Write path for the upstream extractor and a read-only view of how a stored profile flattens.
 */
@RestController
@RequestMapping("/api/profiles")
public class ProfileController {

    private final ProfileStore store;
    private final ResumeProfileReader reader;
    private final ProfileFlattener flattener;

    public ProfileController(ProfileStore store, ResumeProfileReader reader, ProfileFlattener flattener) {
        this.store = store;
        this.reader = reader;
        this.flattener = flattener;
    }

    @PutMapping("/{externalId}")
    public ProfileModels.ProfileSummary upsert(@PathVariable("externalId") String externalId,
                                               @RequestBody ProfileModels.UpsertRequest req) {
        ResumeProfile profile = reader.read(req.getProfile());
        ResumeProfileRecord saved = store.upsert(externalId, profile, req.getProvenanceTag(), req.getSourcePath());
        return ProfileModels.ProfileSummary.of(saved);
    }

    @GetMapping("/{externalId}")
    public ProfileModels.ProfileSummary get(@PathVariable("externalId") String externalId) {
        return ProfileModels.ProfileSummary.of(store.findByExternalId(externalId));
    }

    @GetMapping("/{externalId}/flattened")
    public ProfileModels.FlattenedProfile flattened(@PathVariable("externalId") String externalId) {
        ResumeProfileRecord r = store.findByExternalId(externalId);
        String text = flattener.flatten(r.getProfileJson());
        if (text.isBlank()) {
            throw new ValidationException("Row " + r.getId() + " produced empty flattened resume text.");
        }
        ProfileModels.FlattenedProfile out = new ProfileModels.FlattenedProfile();
        out.setId(r.getId());
        out.setExternalId(r.getExternalId());
        out.setFlattenedText(text);
        return out;
    }
}
