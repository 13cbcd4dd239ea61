package com.explify.sidecar.service;

import com.explify.sidecar.exception.ForbiddenException;
import com.explify.sidecar.exception.UnauthenticatedException;
import com.explify.sidecar.model.User;
import com.explify.sidecar.repository.UserRepository;
import com.explify.sidecar.security.AdminAllowlist;
import com.explify.sidecar.util.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides administrative privilege: the caller's directory e-mail must be on the allow-list.
 * An empty allow-list denies everyone.
 */
@Service
public class AdminAuthorizer {
    private static final Logger log = LoggerFactory.getLogger(AdminAuthorizer.class);
    static final String NO_ADMINS_CONFIGURED = "No admin users configured.";
    static final String ADMIN_REQUIRED = "Admin access required.";

    private final AdminAllowlist allowlist;
    private final UserRepository userRepository;

    public AdminAuthorizer(AdminAllowlist allowlist, UserRepository userRepository) {
        this.allowlist = allowlist;
        this.userRepository = userRepository;
    }

    public enum Decision {
        OK,
        UNAUTHORIZED,
        FORBIDDEN_NO_ADMINS,
        FORBIDDEN
    }

    public Decision evaluate(String identity) {
        if (identity == null || identity.isBlank()) {
            return Decision.UNAUTHORIZED;
        }
        if (this.allowlist.isEmpty()) {
            return Decision.FORBIDDEN_NO_ADMINS;
        }
        String email = this.userRepository.findById(identity)
                .map(User::getEmail)
                .orElse(null);
        if (email == null || !this.allowlist.contains(email)) {
            return Decision.FORBIDDEN;
        }
        return Decision.OK;
    }

    /**
     * Throws unless the identity is an administrator.
     *
     * @throws UnauthenticatedException when no identity is present
     * @throws ForbiddenException when the identity is not an admin or no admins are configured
     */
    public void requireAdmin(String identity) {
        Decision decision = this.evaluate(identity);
        switch (decision) {
            case OK:
                return;
            case UNAUTHORIZED:
                throw new UnauthenticatedException();
            case FORBIDDEN_NO_ADMINS:
                log.error("Admin operation refused: no admin users configured (app.admin.emails is empty)");
                throw new ForbiddenException(NO_ADMINS_CONFIGURED);
            default:
                log.warn("Admin operation refused for identity {}", LogSanitizer.sanitize(identity));
                throw new ForbiddenException(ADMIN_REQUIRED);
        }
    }
}
