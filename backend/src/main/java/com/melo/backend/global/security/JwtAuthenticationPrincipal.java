package com.melo.backend.global.security;

import java.util.List;

public record JwtAuthenticationPrincipal(String userId, List<String> roles) {
}
