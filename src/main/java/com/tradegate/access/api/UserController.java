package com.tradegate.access.api;

import com.tradegate.access.domain.DomainModels.SubscriptionTier;
import com.tradegate.access.domain.DomainModels.User;
import com.tradegate.access.user.UserDirectory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Seeds the user, role and subscription store; identity itself lives elsewhere. */
@RestController
@RequestMapping("/api/users")
public class UserController {
    private final UserDirectory users;

    public UserController(UserDirectory users) {
        this.users = users;
    }

    @PostMapping
    public ResponseEntity<User> register(@RequestBody User user) {
        return ResponseEntity.ok(users.register(user));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<User> user(@PathVariable String userId) {
        return ResponseEntity.ok(users.user(userId));
    }

    @PutMapping("/{userId}/subscription")
    public ResponseEntity<User> changeSubscription(@PathVariable String userId,
                                                   @Valid @RequestBody SubscriptionRequest request) {
        return ResponseEntity.ok(users.changeSubscription(userId, request.tier()));
    }

    public record SubscriptionRequest(@NotNull SubscriptionTier tier) {}
}
