package com.syntegra.assessment.security;

import com.syntegra.assessment.modules.auth.AuthSessionService;
import io.jsonwebtoken.Claims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtTokenProvider jwtTokenProvider;
    private final AuthSessionService authSessionService;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        String token = extractTokenFromRequest(request);

        if (token != null && jwtTokenProvider.validateToken(token)) {
            try {
                AuthenticatedUser user = toPrincipal(jwtTokenProvider.extractAllClaims(token));
                if (user != null) {
                    SecurityContextHolder.getContext().setAuthentication(
                            new UsernamePasswordAuthenticationToken(user, null, user.getAuthorities()));
                }
            } catch (IllegalArgumentException e) {
                log.debug("Could not set user authentication: {}", e.getMessage());
            }
        }

        filterChain.doFilter(request, response);
    }

    /**
     * Builds the principal for a verified token, or returns null when the
     * token lacks a subject or role, or is bound to a login session that is
     * no longer usable.
     */
    private AuthenticatedUser toPrincipal(Claims claims) {
        String subject = claims.getSubject();
        String role = claims.get("role", String.class);
        if (!StringUtils.hasText(subject) || !StringUtils.hasText(role)) {
            log.debug("Rejected token without subject or role");
            return null;
        }
        UUID userId = UUID.fromString(subject);

        // A token bound to a login session is only honoured while that session is live
        String sid = claims.get("sid", String.class);
        UUID authSessionId = sid != null ? UUID.fromString(sid) : null;
        if (authSessionId != null && !authSessionService.isUsable(authSessionId, userId)) {
            log.debug("Rejected token for inactive auth session {}", sid);
            return null;
        }
        return new AuthenticatedUser(userId, claims.get("email", String.class), role, authSessionId);
    }

    private String extractTokenFromRequest(HttpServletRequest request) {
        String bearerToken = request.getHeader("Authorization");
        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }
}
