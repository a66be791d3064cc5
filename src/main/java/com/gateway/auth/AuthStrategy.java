package com.gateway.auth;

import com.gateway.model.AuthConfig;
import com.gateway.model.AuthScheme;

/**
 * Turns one kind of {@link AuthConfig} into request credentials.
 */
public interface AuthStrategy {

    AuthScheme scheme();

    /**
     * Produces the credentials for the configuration, or a failed result explaining what is
     * missing. Implementations do not throw for unsatisfiable configurations.
     */
    AuthResult authenticate(AuthConfig config, AuthContext context);
}
