package io.github.drompincen.bugtrackr.persistence.repository;

import io.github.drompincen.bugtrackr.persistence.codec.CommentCodec;
import io.github.drompincen.bugtrackr.persistence.store.DocumentStoreClient;
import io.github.drompincen.bugtrackr.persistence.store.StoreSettings;
import io.github.drompincen.bugtrackr.protocol.api.Comment;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;

@Repository
public class CommentRepository extends CollectionRepository<Comment> {

    private static final Comparator<Comment> OLDEST_FIRST =
            Comparator.comparing(Comment::createdAt, Comparator.nullsLast(Comparator.naturalOrder()));

    public CommentRepository(DocumentStoreClient store, CommentCodec codec, StoreSettings settings) {
        super(store, codec, settings);
    }

    @Override
    protected Comparator<Comment> defaultOrder() {
        return OLDEST_FIRST;
    }

    public List<Comment> findByBugId(String bugId) {
        return findAll(Filters.equalTo(Comment::bugId, bugId));
    }
}
