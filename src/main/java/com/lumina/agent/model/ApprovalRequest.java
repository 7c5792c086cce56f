package com.lumina.agent.model;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ApprovalRequest {

    @NotNull(message = "approved must be set")
    private Boolean approved;
}
