package com.taskhub.api.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.taskhub.api.domain.validation.ImageFile;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.web.multipart.MultipartFile;

public class RegistrationRequestDto {

    @NotBlank(message = "The name field is required.")
    @Size(max = 255, message = "The name field must not be greater than 255 characters.")
    private String name;

    @NotBlank(message = "The email field is required.")
    @Email(message = "The email field must be a valid email address.")
    @Size(max = 255, message = "The email field must not be greater than 255 characters.")
    private String email;

    @NotBlank(message = "The password field is required.")
    @Size(min = 6, message = "The password field must be at least 6 characters.")
    private String password;

    // Only bound from multipart/form-data requests
    @JsonIgnore
    @ImageFile
    private MultipartFile avatar;

    // Getters and setters
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public MultipartFile getAvatar() {
        return avatar;
    }

    public void setAvatar(MultipartFile avatar) {
        this.avatar = avatar;
    }
}
