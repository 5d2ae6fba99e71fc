package io.github.drompincen.bugtrackr.persistence.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.bugtrackr.persistence.codec.UserCodec;
import io.github.drompincen.bugtrackr.persistence.store.DocumentStoreClient;
import io.github.drompincen.bugtrackr.persistence.store.StoreSettings;
import io.github.drompincen.bugtrackr.persistence.store.StoredItem;
import io.github.drompincen.bugtrackr.protocol.api.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserRepositoryTest {

    @Mock private DocumentStoreClient store;

    private UserRepository repository;

    @BeforeEach
    void setUp() {
        repository = new UserRepository(store, new UserCodec(new ObjectMapper()),
                new StoreSettings("https://store.example.test", "key", null, ""));
        when(store.getAll("")).thenReturn(List.of(
                user("u2", "zoe", "Zoe@Example.com", "developer"),
                user("u1", "adam", "adam@example.com", "Admin"),
                StoredItem.of(Map.of("__auto_id__", "c1", "type", "comment"))));
    }

    private static StoredItem user(String id, String name, String email, String role) {
        return StoredItem.of(Map.of("__auto_id__", id, "name", name,
                "description", "{\"type\":\"user\",\"email\":\"" + email + "\",\"role\":\"" + role + "\"}",
                "created_at", "2024-01-01 00:00:00"));
    }

    @Test
    void listsUsersByName() {
        assertThat(repository.findAll()).extracting(User::id).containsExactly("u1", "u2");
    }

    @Test
    void findsByEmailIgnoringCase() {
        assertThat(repository.findByEmail("zoe@example.com")).map(User::id).contains("u2");
        assertThat(repository.findByEmail("nobody@example.com")).isEmpty();
    }

    @Test
    void findsByRoleIgnoringCase() {
        assertThat(repository.findByRole("admin")).extracting(User::id).containsExactly("u1");
    }
}
