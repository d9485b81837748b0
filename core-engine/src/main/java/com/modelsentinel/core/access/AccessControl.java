package com.modelsentinel.core.access;

import com.modelsentinel.core.error.AuthenticationException;

/**
 * Credential verification and permission checks.
 *
 * <p>
 * The engine itself never verifies credentials; it trusts the actor id it is
 * given. This seam is used by the request-handling layer in front of it.
 * </p>
 */
public interface AccessControl {

    /**
     * @param bearerToken credential presented by the caller
     * @return the authenticated principal
     * @throws AuthenticationException for missing, unknown or inactive
     *                                 credentials
     */
    Principal authenticate(String bearerToken);

    /**
     * @return {@code true} if the principal holds the permission
     */
    boolean authorize(Principal principal, Permission permission);
}
