package com.explify.sidecar.repository;

import com.explify.sidecar.model.User;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Read access to the user directory.
 */
@Repository
public interface UserRepository extends MongoRepository<User, String> {
}
