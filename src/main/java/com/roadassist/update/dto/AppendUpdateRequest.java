package com.roadassist.update.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record AppendUpdateRequest(@NotBlank(message = "Message is required") String message,
                                  List<String> images) {
}
