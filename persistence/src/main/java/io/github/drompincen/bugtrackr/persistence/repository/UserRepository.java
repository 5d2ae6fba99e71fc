package io.github.drompincen.bugtrackr.persistence.repository;

import io.github.drompincen.bugtrackr.persistence.codec.UserCodec;
import io.github.drompincen.bugtrackr.persistence.store.DocumentStoreClient;
import io.github.drompincen.bugtrackr.persistence.store.StoreSettings;
import io.github.drompincen.bugtrackr.protocol.api.User;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Repository
public class UserRepository extends CollectionRepository<User> {

    private static final Comparator<User> BY_NAME = Comparator.comparing(User::name, String.CASE_INSENSITIVE_ORDER);

    public UserRepository(DocumentStoreClient store, UserCodec codec, StoreSettings settings) {
        super(store, codec, settings);
    }

    @Override
    protected Comparator<User> defaultOrder() {
        return BY_NAME;
    }

    public Optional<User> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return findAll(user -> user.email().equalsIgnoreCase(email.strip())).stream().findFirst();
    }

    public List<User> findByRole(String role) {
        return findAll(user -> user.role().equalsIgnoreCase(role));
    }
}
