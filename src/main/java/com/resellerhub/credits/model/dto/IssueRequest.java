package com.resellerhub.credits.model.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class IssueRequest {

    @NotNull(message = "to_account_id is required")
    private Long toAccountId;

    @NotNull(message = "amount is required")
    private Long amount;

    @Size(max = 500, message = "note must be at most 500 characters")
    private String note;
}
