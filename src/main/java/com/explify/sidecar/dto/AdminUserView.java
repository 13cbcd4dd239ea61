package com.explify.sidecar.dto;

import com.explify.sidecar.model.User;
import java.time.Instant;

public record AdminUserView(String id, String email, Instant createdAt, Instant lastSignInAt) {

    public static AdminUserView from(User user) {
        return new AdminUserView(user.getId(), user.getEmail(), user.getCreatedAt(), user.getLastSignInAt());
    }
}
