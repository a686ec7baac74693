package com.taskhub.api.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class UpdateTaskRequestDto {

    @NotBlank(message = "The state field is required.")
    @Size(max = 255, message = "The state field must not be greater than 255 characters.")
    private String state;

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }
}
