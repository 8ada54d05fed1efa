package chronokms.adapter.in.dto;

import java.time.Instant;

/**
 * Successful login. {@code sessionId} is sent back as {@code Authorization: Bearer <sessionId>}.
 */
public record LoginResponse(String sessionId, Instant expiresAt, AdminDto admin) {}
