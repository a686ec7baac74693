package com.taskhub.api.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class UpdatePasswordRequestDto {

    @NotBlank(message = "The password field is required.")
    @Size(min = 6, message = "The password field must be at least 6 characters.")
    private String password;

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }
}
