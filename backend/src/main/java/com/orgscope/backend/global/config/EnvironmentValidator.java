package com.orgscope.backend.global.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

import com.orgscope.backend.modules.access.config.AccessPolicyProperties;
import com.orgscope.backend.modules.access.config.AccessPolicyProperties.RolePolicy;

/**
 * Fails startup when required settings are missing or the role table is inconsistent.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_JWT_SECRET = "dev-jwt-secret-key-change-in-production-0000";
    private static final int MIN_JWT_SECRET_LENGTH = 32;
    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "app.cors.allowed-origins"
    };

    private final Environment environment;
    private final AccessPolicyProperties accessPolicy;

    public EnvironmentValidator(Environment environment, AccessPolicyProperties accessPolicy) {
        this.environment = environment;
        this.accessPolicy = accessPolicy;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = findProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated: {} roles, branch scope covers corporate departments={}",
                accessPolicy.roles().size(), accessPolicy.branchScopeIncludesCorporateDepartments());
    }

    List<String> findProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add("missing " + key);
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (jwtSecret.filter(DEFAULT_JWT_SECRET::equals).isPresent()
                && !environment.acceptsProfiles(Profiles.of("local", "test"))) {
            problems.add("jwt.secret still has the development default");
        }
        if (jwtSecret.filter(secret -> !secret.isBlank() && secret.length() < MIN_JWT_SECRET_LENGTH).isPresent()) {
            problems.add("jwt.secret must be at least " + MIN_JWT_SECRET_LENGTH + " characters");
        }

        Set<Integer> levels = new HashSet<>();
        for (RolePolicy role : accessPolicy.roles()) {
            if (role.level() < 1) {
                problems.add("orgscope.access.roles: level must be positive, got " + role.level());
            }
            if (!levels.add(role.level())) {
                problems.add("orgscope.access.roles: duplicate level " + role.level());
            }
        }
        if (accessPolicy.role(accessPolicy.scopeAdminMaxLevel()).isEmpty()) {
            problems.add("orgscope.access.scope-admin-max-level refers to unknown level " + accessPolicy.scopeAdminMaxLevel());
        }
        if (accessPolicy.role(accessPolicy.permissionAdminMaxLevel()).isEmpty()) {
            problems.add("orgscope.access.permission-admin-max-level refers to unknown level "
                    + accessPolicy.permissionAdminMaxLevel());
        }
        if (accessPolicy.basePathSegments() < 1) {
            problems.add("orgscope.access.base-path-segments must be at least 1");
        }
        return problems;
    }
}
