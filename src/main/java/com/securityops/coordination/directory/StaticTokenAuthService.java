package com.securityops.coordination.directory;

import com.securityops.coordination.config.CoordinationProperties;
import com.securityops.coordination.dto.AuthenticatedPrincipal;
import com.securityops.coordination.exception.AuthenticationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token table backed by {@code coordination.auth.static-tokens}. Used when no real identity
 * provider integration is deployed (local development, demos).
 */
@Slf4j
public class StaticTokenAuthService implements AuthService {

    private final Map<String, AuthenticatedPrincipal> principalsByToken = new ConcurrentHashMap<>();

    public StaticTokenAuthService(CoordinationProperties properties) {
        for (CoordinationProperties.Auth.StaticToken entry : properties.getAuth().getStaticTokens()) {
            register(entry.getToken(), new AuthenticatedPrincipal(
                    entry.getUserId(), entry.getRole(), entry.getAgentId(), entry.getClientId()));
        }
        log.info("Static token auth initialised with {} tokens", principalsByToken.size());
    }

    public void register(String token, AuthenticatedPrincipal principal) {
        principalsByToken.put(token, principal);
    }

    @Override
    public AuthenticatedPrincipal authenticate(String sessionToken) {
        if (sessionToken == null || sessionToken.isBlank()) {
            throw new AuthenticationException("Authentication token required");
        }
        String token = sessionToken.startsWith("Bearer ") ? sessionToken.substring("Bearer ".length()) : sessionToken;
        AuthenticatedPrincipal principal = principalsByToken.get(token);
        if (principal == null) {
            throw new AuthenticationException("Invalid authentication token");
        }
        return principal;
    }
}
