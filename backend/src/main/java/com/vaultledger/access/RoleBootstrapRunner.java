package com.vaultledger.access;

import com.vaultledger.access.config.AccessProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Assigns both roles to the configured bootstrap principal on first start.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RoleBootstrapRunner implements ApplicationRunner {

    private final PermissionGate permissionGate;
    private final AccessProperties accessProperties;

    @Override
    public void run(ApplicationArguments args) {
        String principal = accessProperties.getBootstrapPrincipal();
        if (principal == null || principal.isBlank()) {
            log.debug("No bootstrap principal configured");
            return;
        }
        if (permissionGate.hasAdministrator()) {
            log.debug("Administrator already assigned; skipping role bootstrap");
            return;
        }
        permissionGate.bootstrap(principal);
    }
}
