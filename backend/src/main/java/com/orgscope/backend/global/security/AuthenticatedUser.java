package com.orgscope.backend.global.security;

/**
 * Caller identity extracted from a verified bearer token.
 * Scopes are not part of the token; they are loaded per request by the access module.
 */
public record AuthenticatedUser(Long userId, String loginId, int roleLevel) {
}
