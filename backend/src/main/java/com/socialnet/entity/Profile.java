package com.socialnet.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Public profile of a user. Posts are authored by profiles, not by users.
 *
 * The numeric id is what scheduled post payloads reference as {@code authorId}.
 *
 * Database Table: profiles
 */
@Entity
@Table(name = "profiles", indexes = {
    @Index(name = "idx_profile_username", columnList = "username", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Profile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Owning user account.
     */
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, unique = true,
            foreignKey = @ForeignKey(name = "fk_profile_user"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User user;

    @Column(name = "username", nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "first_name", length = 50)
    private String firstName;

    @Column(name = "last_name", length = 50)
    private String lastName;

    @Column(name = "bio", columnDefinition = "TEXT")
    private String bio;

    @Column(name = "birth_date")
    private LocalDate birthDate;

    @Column(name = "phone_number", length = 20)
    private String phoneNumber;

    /**
     * Path of the uploaded profile image relative to the media root.
     */
    @Column(name = "profile_image", length = 500)
    private String profileImage;

    public Profile(User user, String username, String firstName, String lastName) {
        this.user = user;
        this.username = username;
        this.firstName = firstName;
        this.lastName = lastName;
    }
}
