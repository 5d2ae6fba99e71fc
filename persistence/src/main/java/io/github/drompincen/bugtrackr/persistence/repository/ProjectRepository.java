package io.github.drompincen.bugtrackr.persistence.repository;

import io.github.drompincen.bugtrackr.persistence.codec.ProjectCodec;
import io.github.drompincen.bugtrackr.persistence.store.DocumentStoreClient;
import io.github.drompincen.bugtrackr.persistence.store.StoreSettings;
import io.github.drompincen.bugtrackr.protocol.api.Project;
import org.springframework.stereotype.Repository;

import java.util.Comparator;

@Repository
public class ProjectRepository extends CollectionRepository<Project> {

    private static final Comparator<Project> BY_CREATION =
            Comparator.comparing(Project::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(Project::name);

    public ProjectRepository(DocumentStoreClient store, ProjectCodec codec, StoreSettings settings) {
        super(store, codec, settings);
    }

    @Override
    protected Comparator<Project> defaultOrder() {
        return BY_CREATION;
    }
}
