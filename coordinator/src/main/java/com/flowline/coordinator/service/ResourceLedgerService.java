package com.flowline.coordinator.service;

import com.flowline.coordinator.model.BuildInput;
import com.flowline.coordinator.model.BuildOutput;
import com.flowline.coordinator.model.BuildResources;
import com.flowline.coordinator.model.LedgerOutput;
import com.flowline.coordinator.model.SavedVersionedResource;
import com.flowline.coordinator.model.VersionedResource;
import com.flowline.coordinator.repository.BuildRepository;
import com.flowline.coordinator.repository.VersionedResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records which resource versions each build consumed and produced.
 *
 * Versions are shared per pipeline: saving the same (resource, type, version)
 * twice, from any build, yields the same saved row.
 */
@Service
public class ResourceLedgerService {

    private static final Logger log = LoggerFactory.getLogger(ResourceLedgerService.class);

    private final VersionedResourceStore store;
    private final BuildRepository        buildRepo;

    public ResourceLedgerService(VersionedResourceStore store, BuildRepository buildRepo) {
        this.store     = store;
        this.buildRepo = buildRepo;
    }

    /** Link a version as the build's input; re-saving under the same name replaces it. */
    @Transactional
    public SavedVersionedResource saveInput(long buildId, BuildInput input) {
        requireBuild(buildId);
        if (input.name() == null || input.name().isBlank()) {
            throw new IllegalArgumentException("Build input needs a name");
        }
        SavedVersionedResource saved = store.upsert(validated(input.versionedResource()));
        store.linkInput(buildId, saved.id(), input.name());
        log.debug("Build {} input '{}' -> versioned resource {}", buildId, input.name(), saved.id());
        return saved;
    }

    /**
     * Link a version as the build's output. Implicit outputs (versions the
     * build merely touched) are kept apart from explicit ones and hidden
     * from {@link #getResources}.
     */
    @Transactional
    public SavedVersionedResource saveOutput(long buildId, VersionedResource output, boolean explicit) {
        requireBuild(buildId);
        SavedVersionedResource saved = store.upsert(validated(output));
        store.linkOutput(buildId, saved.id(), explicit);
        log.debug("Build {} {} output -> versioned resource {}",
                buildId, explicit ? "explicit" : "implicit", saved.id());
        return saved;
    }

    /** Inputs and explicit outputs; empty lists for a build with nothing linked. */
    @Transactional(readOnly = true)
    public BuildResources getResources(long buildId) {
        requireBuild(buildId);
        List<BuildOutput> outputs = store.findOutputs(buildId).stream()
                .filter(LedgerOutput::explicit)
                .map(o -> new BuildOutput(o.savedVersionedResource().versionedResource()))
                .toList();
        return new BuildResources(store.findInputs(buildId), outputs);
    }

    /** Saved versions of all inputs followed by all explicit outputs, each version once. */
    @Transactional(readOnly = true)
    public List<SavedVersionedResource> getVersionedResources(long buildId) {
        requireBuild(buildId);
        Map<Long, SavedVersionedResource> byId = new LinkedHashMap<>();
        store.findInputVersions(buildId).forEach(vr -> byId.putIfAbsent(vr.id(), vr));
        store.findOutputs(buildId).stream()
                .filter(LedgerOutput::explicit)
                .forEach(o -> byId.putIfAbsent(o.savedVersionedResource().id(), o.savedVersionedResource()));
        return List.copyOf(byId.values());
    }

    /** Every output link, implicit ones included. */
    @Transactional(readOnly = true)
    public List<LedgerOutput> getAllOutputs(long buildId) {
        requireBuild(buildId);
        return store.findOutputs(buildId);
    }

    private void requireBuild(long buildId) {
        if (!buildRepo.existsById(buildId)) {
            throw new BuildNotFoundException(buildId);
        }
    }

    private static VersionedResource validated(VersionedResource vr) {
        if (vr == null) {
            throw new IllegalArgumentException("Versioned resource is required");
        }
        if (vr.pipelineId() == null) {
            throw new IllegalArgumentException("Versioned resource '" + vr.resource() + "' has no pipeline");
        }
        if (vr.resource() == null || vr.resource().isBlank() || vr.type() == null || vr.type().isBlank()) {
            throw new IllegalArgumentException("Versioned resource needs a resource name and a type");
        }
        return vr;
    }
}
