package io.github.drompincen.bugtrackr.runtime.user;

import io.github.drompincen.bugtrackr.persistence.repository.UserRepository;
import io.github.drompincen.bugtrackr.protocol.api.User;
import io.github.drompincen.bugtrackr.protocol.api.UserRole;
import io.github.drompincen.bugtrackr.protocol.error.NotFoundException;
import io.github.drompincen.bugtrackr.protocol.error.ValidationException;
import io.github.drompincen.bugtrackr.runtime.Requests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;

/** Users are seeded into the store; {@link #createUser} exists for seeding. */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository users;
    private final Clock clock;

    public UserService(UserRepository users, Clock clock) {
        this.users = users;
        this.clock = clock;
    }

    public List<User> listUsers() {
        return users.findAll();
    }

    public User getUser(String userId) {
        return users.get(userId);
    }

    public User getUserByEmail(String email) {
        Requests.requireText("email", email);
        return users.findByEmail(email).orElseThrow(() -> new NotFoundException("user", "email", email));
    }

    public List<User> listUsersByRole(String role) {
        return users.findByRole(UserRole.fromWire(role).wireValue());
    }

    public User createUser(String name, String email, UserRole role) {
        Requests.require("role", role);
        User user = new User(null, name, email, role.wireValue(), clock.instant().truncatedTo(ChronoUnit.SECONDS));
        if (users.findByEmail(user.email()).isPresent()) {
            throw new ValidationException(
                    "User with email " + user.email() + " already exists");
        }
        User created = users.create(user);
        log.info("User created: {} ({})", created.id(), created.role());
        return created;
    }
}
