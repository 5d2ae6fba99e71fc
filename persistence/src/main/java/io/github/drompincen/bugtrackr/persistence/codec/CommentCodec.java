package io.github.drompincen.bugtrackr.persistence.codec;

import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.api.Comment;
import io.github.drompincen.bugtrackr.protocol.api.EntityKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

@Component
public class CommentCodec extends NativeFieldCodec<Comment> {

    public static final String BUG_ID = "bugId";
    public static final String AUTHOR_ID = "authorId";
    public static final String MESSAGE = "message";
    public static final String CREATED_AT = "createdAt";

    @Override
    public EntityKind kind() {
        return EntityKind.COMMENT;
    }

    @Override
    public Map<String, Object> encode(Comment comment) {
        Map<String, Object> fields = typed();
        fields.put(BUG_ID, comment.bugId());
        fields.put(AUTHOR_ID, comment.authorId());
        fields.put(MESSAGE, comment.message());
        fields.put(CREATED_AT, ItemFields.storedValue(comment.createdAt()));
        return fields;
    }

    @Override
    public Comment decode(StoredItem item) {
        String bugId = ItemFields.text(item, BUG_ID);
        String authorId = ItemFields.text(item, AUTHOR_ID);
        String message = ItemFields.text(item, MESSAGE);
        Instant createdAt = ItemFields.timestamp(item, CREATED_AT);
        String id = item.identity().orElse(null);
        return ItemFields.build(item, () -> new Comment(id, bugId, authorId, message, createdAt));
    }

    @Override
    protected Set<String> updatableFields() {
        return Set.of(MESSAGE);
    }

    @Override
    protected Object updateValue(String field, Object value) {
        return requireUpdateText(field, value);
    }
}
