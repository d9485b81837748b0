package com.modelsentinel.core.access;

import com.modelsentinel.core.error.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link AccessControl} backed by a table of issued bearer tokens.
 *
 * <p>
 * Token issuance belongs to the login flow; this class only looks tokens up.
 * Authorization consults {@link CapabilityTable}, so the admin role holds
 * every permission.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryAccessControl implements AccessControl {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryAccessControl.class);

    private final Map<String, Principal> tokens = new ConcurrentHashMap<>();

    /**
     * Make a token known.
     *
     * @param bearerToken the token value; must not be blank
     * @param principal   the principal it identifies
     */
    public void register(String bearerToken, Principal principal) {
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new IllegalArgumentException("bearerToken must not be blank");
        }
        tokens.put(bearerToken, Objects.requireNonNull(principal, "principal must not be null"));
    }

    public void revoke(String bearerToken) {
        tokens.remove(bearerToken);
    }

    @Override
    public Principal authenticate(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            throw new AuthenticationException("Missing bearer token");
        }
        Principal principal = tokens.get(bearerToken);
        if (principal == null) {
            LOG.debug("Rejected unknown bearer token");
            throw new AuthenticationException("Could not validate credentials");
        }
        if (!principal.isActive()) {
            throw new AuthenticationException("Inactive user: " + principal.getId());
        }
        return principal;
    }

    @Override
    public boolean authorize(Principal principal, Permission permission) {
        Objects.requireNonNull(principal, "principal must not be null");
        return principal.isActive() && CapabilityTable.grants(principal.getRole(), permission);
    }
}
