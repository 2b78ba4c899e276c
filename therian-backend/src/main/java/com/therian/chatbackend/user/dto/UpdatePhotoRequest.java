package com.therian.chatbackend.user.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdatePhotoRequest(@NotBlank String photo) {}
