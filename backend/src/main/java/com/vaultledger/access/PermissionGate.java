package com.vaultledger.access;

import com.vaultledger.common.LedgerErrorCode;
import com.vaultledger.common.LedgerException;
import com.vaultledger.domain.LedgerRole;
import com.vaultledger.domain.RoleAssignment;
import com.vaultledger.domain.RoleAssignmentRepository;
import com.vaultledger.domain.RoleChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Two-role permission gate. OPERATOR is checked by registry and limit mutations; ADMINISTRATOR only by role
 * management. No hierarchy: an administrator does not implicitly hold OPERATOR.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PermissionGate {

    private final RoleAssignmentRepository roleAssignmentRepository;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * @throws LedgerException UNAUTHORIZED if principal does not hold role
     */
    public void require(String principal, LedgerRole role) {
        if (!hasRole(principal, role)) {
            throw new LedgerException(LedgerErrorCode.UNAUTHORIZED,
                    "Principal " + principal + " lacks role " + role);
        }
    }

    public boolean hasRole(String principal, LedgerRole role) {
        if (principal == null || principal.isBlank() || role == null) {
            return false;
        }
        return roleAssignmentRepository.existsByPrincipalAndRole(principal.strip(), role);
    }

    public List<String> holdersOf(LedgerRole role) {
        return roleAssignmentRepository.findByRole(role).stream()
                .map(RoleAssignment::getPrincipal)
                .toList();
    }

    /**
     * Grant role to principal. Idempotent: granting an already-held role changes nothing.
     *
     * @throws LedgerException UNAUTHORIZED if actor is not an administrator
     */
    @Transactional
    public void grantRole(String actor, String principal, LedgerRole role) {
        require(actor, LedgerRole.ADMINISTRATOR);
        String target = requirePrincipal(principal);
        if (roleAssignmentRepository.existsByPrincipalAndRole(target, role)) {
            return;
        }
        assign(actor, target, role);
        applicationEventPublisher.publishEvent(new RoleChangedEvent(actor, target, role, true));
        log.info("Role {} granted to {} by {}", role, target, actor);
    }

    /**
     * Revoke role from principal. Revoking a role that is not held changes nothing.
     *
     * @throws LedgerException UNAUTHORIZED if actor is not an administrator
     */
    @Transactional
    public void revokeRole(String actor, String principal, LedgerRole role) {
        require(actor, LedgerRole.ADMINISTRATOR);
        String target = requirePrincipal(principal);
        if (roleAssignmentRepository.deleteByPrincipalAndRole(target, role) > 0) {
            applicationEventPublisher.publishEvent(new RoleChangedEvent(actor, target, role, false));
            log.info("Role {} revoked from {} by {}", role, target, actor);
        }
    }

    /**
     * Initial assignment, bypassing the administrator check. Used once at startup.
     */
    @Transactional
    public void bootstrap(String principal) {
        String target = requirePrincipal(principal);
        for (LedgerRole role : LedgerRole.values()) {
            if (!roleAssignmentRepository.existsByPrincipalAndRole(target, role)) {
                assign("bootstrap", target, role);
            }
        }
        log.info("Bootstrapped roles {} for {}", List.of(LedgerRole.values()), target);
    }

    public boolean hasAdministrator() {
        return roleAssignmentRepository.existsByRole(LedgerRole.ADMINISTRATOR);
    }

    private void assign(String actor, String principal, LedgerRole role) {
        RoleAssignment assignment = new RoleAssignment();
        assignment.setPrincipal(principal);
        assignment.setRole(role);
        assignment.setGrantedBy(actor);
        assignment.setGrantedAt(Instant.now());
        roleAssignmentRepository.save(assignment);
    }

    private static String requirePrincipal(String principal) {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("principal must not be blank");
        }
        return principal.strip();
    }
}
