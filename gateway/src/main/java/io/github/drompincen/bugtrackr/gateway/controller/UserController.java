package io.github.drompincen.bugtrackr.gateway.controller;

import io.github.drompincen.bugtrackr.protocol.api.User;
import io.github.drompincen.bugtrackr.runtime.user.UserService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @GetMapping
    public List<User> list(@RequestParam(required = false) String role) {
        return role == null || role.isBlank() ? userService.listUsers() : userService.listUsersByRole(role);
    }

    @GetMapping("/{userId}")
    public User get(@PathVariable String userId) {
        return userService.getUser(userId);
    }

    @GetMapping("/by-email")
    public User byEmail(@RequestParam String email) {
        return userService.getUserByEmail(email);
    }
}
