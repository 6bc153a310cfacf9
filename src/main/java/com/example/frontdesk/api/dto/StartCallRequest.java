package com.example.frontdesk.api.dto;

import jakarta.validation.constraints.NotBlank;

public record StartCallRequest(@NotBlank String callerId, @NotBlank String callerContact) {
}
