package com.questrail.lantern.hack;

import com.questrail.lantern.api.NotFoundException;
import com.questrail.lantern.model.GameUser;
import com.questrail.lantern.model.HackSession;
import com.questrail.lantern.model.PasswordHint;
import com.questrail.lantern.model.SessionGameUser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * SessionGenerator
 * -----------------------------------------------------------------------------
 * Draws the game users of a fresh hack session.
 *
 * <ol>
 *   <li>Shuffle the station's game users and keep the first
 *       {@code candidatesPerSession}</li>
 *   <li>For each, commit one password at random and a hint at a random
 *       position of it</li>
 *   <li>Flag the first drawn user as the correct one</li>
 * </ol>
 *
 * Since the draw is shuffled, "first" is a uniformly random pick.
 */
public final class SessionGenerator
{
    private final Random random;

    public SessionGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * @throws NotFoundException if {@code candidates} is empty
     */
    public HackSession generate(String owner, int stationId, List<GameUser> candidates,
                                int candidatesPerSession, int triesBudget)
    {
        if (candidates.isEmpty()) {
            throw new NotFoundException("game users for station " + stationId);
        }

        List<GameUser> drawn = new ArrayList<>(candidates);
        Collections.shuffle(drawn, random);
        drawn = drawn.subList(0, Math.min(candidatesPerSession, drawn.size()));

        List<SessionGameUser> gameUsers = new ArrayList<>(drawn.size());
        for (int i = 0; i < drawn.size(); i++) {
            GameUser user = drawn.get(i);
            String password = user.passwords().get(random.nextInt(user.passwords().size()));
            PasswordHint hint = PasswordHint.of(password, random.nextInt(password.length()));
            gameUsers.add(new SessionGameUser(user.userName(), password, hint, i == 0));
        }

        return new HackSession(owner, stationId, gameUsers, triesBudget);
    }
}
