package com.securityops.coordination.config;

import com.securityops.coordination.directory.AuthService;
import com.securityops.coordination.directory.DirectoryService;
import com.securityops.coordination.directory.InMemoryDirectoryService;
import com.securityops.coordination.directory.StaticTokenAuthService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default implementations of the directory and identity collaborators.
 *
 * Both are only created when the deployment does not provide its own bean, so an integration
 * with the workforce database or an identity provider replaces them by declaring one.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean(DirectoryService.class)
    public InMemoryDirectoryService directoryService() {
        return new InMemoryDirectoryService();
    }

    @Bean
    @ConditionalOnMissingBean(AuthService.class)
    public StaticTokenAuthService authService(CoordinationProperties properties) {
        return new StaticTokenAuthService(properties);
    }
}
