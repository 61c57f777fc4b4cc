package com.questrail.lantern.auth;

import com.questrail.lantern.api.AttemptResult;
import com.questrail.lantern.api.HackView;
import com.questrail.lantern.api.InvalidDataException;
import com.questrail.lantern.api.LanternHackingEngine;
import com.questrail.lantern.api.LanternInfo;

import java.util.Objects;

/**
 * LanternHackingService
 * =============================================================================
 * Entry point for request handlers: validates caller input, authorizes the
 * credential for {@value #HACK_LANTERN_COMMAND}, and calls the engine with the
 * authorized user as session owner.
 *
 * <p>Validation happens before authorization, so malformed input is reported
 * as {@link InvalidDataException} even for an unknown token. Authorization
 * failures propagate unchanged.</p>
 */
public final class LanternHackingService
{
    public static final String HACK_LANTERN_COMMAND = "HackLantern";

    private final LanternHackingEngine engine;
    private final Authorizer authorizer;

    public LanternHackingService(LanternHackingEngine engine, Authorizer authorizer) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
    }

    public HackView getLanternHack(String token, Integer stationId) {
        if (stationId == null || stationId < 0) {
            throw new InvalidDataException("expected { stationId }");
        }

        AuthorizedUser user = authorizer.isAllowed(token, HACK_LANTERN_COMMAND);
        return engine.getOrCreateSession(user.userName(), stationId);
    }

    public AttemptResult manipulateStation(String token, String password, Boolean boostingSignal) {
        if (password == null || password.isBlank() || boostingSignal == null) {
            throw new InvalidDataException("expected { password, boostingSignal }");
        }

        AuthorizedUser user = authorizer.isAllowed(token, HACK_LANTERN_COMMAND);
        return engine.attempt(user.userName(), password, boostingSignal);
    }

    public LanternInfo getLanternInfo(String token) {
        authorizer.isAllowed(token, HACK_LANTERN_COMMAND);
        return engine.lanternInfo();
    }
}
