package com.procflow.backend.modules.lifecycle.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateLifecycleInstanceRequest(
        @NotBlank @Size(max = 64) String lifecycleCode
) {
}
