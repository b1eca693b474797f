package com.bbthechange.retroboard.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Promotes a participant, identified by the user hash they see on their own board view.
 */
public class AddAdminRequest {

    @NotBlank(message = "User hash is required")
    @Pattern(regexp = "[0-9a-f]{64}", message = "Invalid user hash format")
    private String userHash;

    public AddAdminRequest() {}

    public AddAdminRequest(String userHash) {
        this.userHash = userHash;
    }

    public String getUserHash() {
        return userHash;
    }

    public void setUserHash(String userHash) {
        this.userHash = userHash;
    }
}
