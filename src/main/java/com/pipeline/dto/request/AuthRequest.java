package com.pipeline.dto.request;

/**
 * Arguments of the {@code auth} command.
 *
 * @param service the configured service the credential belongs to
 * @param token   the credential
 */
public record AuthRequest(String service, String token) {
}
