package com.explify.sidecar.model;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Directory entry for a registered user. The id is the identity provider subject.
 * Written by the account sync; this service only reads it.
 */
@Document(collection="users")
public class User {
    @Id
    private String id;
    @Indexed(unique=true)
    private String email;
    private Instant createdAt;
    private Instant lastSignInAt;

    public User() {
    }

    public User(String id, String email) {
        this.id = id;
        this.email = email;
        this.createdAt = Instant.now();
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEmail() {
        return this.email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public Instant getCreatedAt() {
        return this.createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastSignInAt() {
        return this.lastSignInAt;
    }

    public void setLastSignInAt(Instant lastSignInAt) {
        this.lastSignInAt = lastSignInAt;
    }
}
