package com.teamchat.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "missing_username")
        @Size(min = 3, max = 30, message = "bad_username")
        @Pattern(regexp = "^[a-zA-Z0-9_-]+$", message = "bad_username")
        String username,

        @NotBlank(message = "missing_email")
        @Size(max = 160, message = "bad_email")
        @Email(message = "bad_email")
        @Pattern(regexp = "^[^\\s]+@[^\\s]+$", message = "bad_email")
        String email,

        @NotBlank(message = "missing_password")
        @Size(min = 8, max = 72, message = "bad_password")
        @Pattern(regexp = "^(?=.*[a-z])(?=.*[A-Z])(?=.*[\\d\\p{Punct}]).*$", message = "weak_password")
        String password,

        @Size(max = 64, message = "bad_first_name")
        String firstName,

        @Size(max = 64, message = "bad_last_name")
        String lastName
) {
}
