package com.therian.chatbackend.auth.dto;

import com.therian.chatbackend.user.dto.UserProfileDto;

public record LoginResponse(String token, UserProfileDto user) {}
