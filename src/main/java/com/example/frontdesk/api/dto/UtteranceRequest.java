package com.example.frontdesk.api.dto;

import jakarta.validation.constraints.NotBlank;

public record UtteranceRequest(@NotBlank String text) {
}
