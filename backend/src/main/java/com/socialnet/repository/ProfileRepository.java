package com.socialnet.repository;

import com.socialnet.entity.Profile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for Profile entity.
 */
@Repository
public interface ProfileRepository extends JpaRepository<Profile, Long> {

    Optional<Profile> findByUserId(UUID userId);

    boolean existsByUsername(String username);

    /**
     * Case-insensitive contains search. Null filters match everything.
     */
    @Query("SELECT p FROM Profile p " +
           "WHERE (:username IS NULL OR LOWER(p.username) LIKE LOWER(CONCAT('%', :username, '%'))) " +
           "AND (:firstName IS NULL OR LOWER(p.firstName) LIKE LOWER(CONCAT('%', :firstName, '%'))) " +
           "AND (:lastName IS NULL OR LOWER(p.lastName) LIKE LOWER(CONCAT('%', :lastName, '%'))) " +
           "ORDER BY p.username ASC")
    List<Profile> search(@Param("username") String username,
                         @Param("firstName") String firstName,
                         @Param("lastName") String lastName);
}
