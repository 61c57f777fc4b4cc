package com.questrail.lantern.auth;

import com.questrail.lantern.api.NotAllowedException;

/**
 * Authorizer
 * -----------------------------------------------------------------------------
 * Turns a caller credential into an {@link AuthorizedUser} for one command.
 *
 * <p>The token format belongs to the authentication layer; the engine only
 * passes it through.</p>
 */
public interface Authorizer
{
    /**
     * @throws NotAllowedException if the credential may not run {@code commandName}
     */
    AuthorizedUser isAllowed(String token, String commandName) throws NotAllowedException;
}
