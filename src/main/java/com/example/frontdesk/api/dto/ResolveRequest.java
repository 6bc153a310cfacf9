package com.example.frontdesk.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/requests/{id}/resolve}.
 */
public record ResolveRequest(@NotBlank(message = "Answer is required") String answer, String supervisorName) {
}
