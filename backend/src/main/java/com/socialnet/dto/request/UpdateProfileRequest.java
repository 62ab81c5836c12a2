package com.socialnet.dto.request;

import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Partial profile update; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProfileRequest {

    @Size(min = 1, max = 50, message = "Username must be 1 to 50 characters")
    @Pattern(regexp = "^[A-Za-z0-9_.-]+$", message = "Username may contain letters, digits, '_', '.' and '-'")
    private String username;

    @Size(max = 50, message = "First name must be at most 50 characters")
    private String firstName;

    @Size(max = 50, message = "Last name must be at most 50 characters")
    private String lastName;

    @Size(max = 2000, message = "Bio must be at most 2000 characters")
    private String bio;

    @Past(message = "Birth date must be in the past")
    private LocalDate birthDate;

    @Size(max = 20, message = "Phone number must be at most 20 characters")
    @Pattern(regexp = "^\\+?[0-9 ()-]*$", message = "Phone number may contain digits, spaces, '(', ')', '-' and a leading '+'")
    private String phoneNumber;
}
