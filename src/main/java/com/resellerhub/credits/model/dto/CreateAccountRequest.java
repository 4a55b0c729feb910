package com.resellerhub.credits.model.dto;

import com.resellerhub.credits.model.Role;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CreateAccountRequest {

    @NotNull(message = "role is required")
    private Role role;

    @NotBlank(message = "name is required")
    private String name;

    /** Required for BUSINESS_OWNER, forbidden for RESELLER. */
    private Long owningResellerId;
}
