package com.securityops.coordination.directory;

import com.securityops.coordination.dto.AuthenticatedPrincipal;
import com.securityops.coordination.exception.AuthenticationException;

/**
 * Auth collaborator: validates a session token at connection time.
 */
public interface AuthService {

    /**
     * @throws AuthenticationException if the token is missing, unknown or expired
     */
    AuthenticatedPrincipal authenticate(String sessionToken);
}
