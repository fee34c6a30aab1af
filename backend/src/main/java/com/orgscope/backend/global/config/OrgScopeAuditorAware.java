package com.orgscope.backend.global.config;

import java.util.Optional;

import com.orgscope.backend.global.security.AuthenticatedUser;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the current auditor (user id) for the {@code created_by} / {@code updated_by} columns.
 * Falls back to {@code Optional.empty()} when no authenticated principal is available.
 */
public class OrgScopeAuditorAware implements AuditorAware<Long> {

    @Override
    @NonNull
    public Optional<Long> getCurrentAuditor() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        if (authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return Optional.ofNullable(user.userId());
        }

        return Optional.empty();
    }
}
