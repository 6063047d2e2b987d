package io.streamvault.store;

import io.streamvault.core.ProjectionStatus;

import java.util.List;
import java.util.Optional;

public interface ProjectionStatusStore {

    Optional<ProjectionStatus> find(String name);

    List<ProjectionStatus> findAll();

    /** Upsert keyed by projection name. */
    void save(ProjectionStatus status);
}
