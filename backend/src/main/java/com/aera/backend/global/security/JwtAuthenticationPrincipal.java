package com.aera.backend.global.security;

import java.util.List;
import java.util.UUID;

/**
 * Identity asserted by the external auth service. {@code phone} is the invitee identifier
 * used for phone-bound invitations and may be {@code null}.
 */
public record JwtAuthenticationPrincipal(UUID userId, String phone, List<String> roles) {
}
