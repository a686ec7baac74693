package com.taskhub.api.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Only the name is accepted; state and owner are always assigned by the server.
 */
public class CreateTaskRequestDto {

    @NotBlank(message = "The name field is required.")
    @Size(max = 255, message = "The name field must not be greater than 255 characters.")
    private String name;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
