package com.syntegra.assessment.security;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;
import java.util.UUID;

/**
 * Principal placed in the security context for a verified access token.
 */
@Getter
@RequiredArgsConstructor
public class AuthenticatedUser {

    private final UUID userId;
    private final String email;
    private final String role;

    /** Login session the token is bound to; null for unbound tokens. */
    private final UUID authSessionId;

    public boolean isAdmin() {
        return SecurityUtils.ROLE_ADMIN.equals(role);
    }

    public List<GrantedAuthority> getAuthorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_" + role));
    }
}
