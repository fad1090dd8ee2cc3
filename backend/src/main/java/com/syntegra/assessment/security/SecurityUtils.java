package com.syntegra.assessment.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class SecurityUtils {

    public static final String ROLE_ADMIN = "ADMIN";
    public static final String ROLE_PARTICIPANT = "PARTICIPANT";

    public AuthenticatedUser getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return user;
        }
        throw new IllegalStateException("No authenticated user found in security context");
    }

    public UUID getCurrentUserId() {
        return getCurrentUser().getUserId();
    }

    public boolean hasRole(String role) {
        return role.equals(getCurrentUser().getRole());
    }

    public boolean isAdmin() {
        return getCurrentUser().isAdmin();
    }
}
