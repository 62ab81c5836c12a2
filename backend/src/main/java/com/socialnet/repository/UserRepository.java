package com.socialnet.repository;

import com.socialnet.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for User entity.
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Find user by email address (stored lowercased).
     *
     * @param email the normalized email
     * @return Optional containing the user if found
     */
    Optional<User> findByEmail(String email);

    boolean existsByEmail(String email);
}
