package com.questrail.lantern.hack;

import com.questrail.lantern.api.HackView;
import com.questrail.lantern.model.HackSession;
import com.questrail.lantern.model.SessionGameUser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Builds the client-visible payload of a session.
 *
 * <p>Filler passwords are shuffled, the first {@code decoyCount} kept, and the
 * session passwords appended in draw order. The filler is not filtered
 * against the session passwords, so a password can appear twice.</p>
 */
public final class DecoyPayloadBuilder
{
    private final Random random;
    private final int decoyCount;

    public DecoyPayloadBuilder(Random random, int decoyCount) {
        this.random = Objects.requireNonNull(random, "random");
        this.decoyCount = decoyCount;
    }

    public HackView build(HackSession session, List<String> fillerPasswords) {
        List<String> decoys = new ArrayList<>(fillerPasswords);
        Collections.shuffle(decoys, random);

        List<String> passwords = new ArrayList<>(decoys.subList(0, Math.min(decoyCount, decoys.size())));
        for (SessionGameUser user : session.gameUsers()) {
            passwords.add(user.password());
        }

        SessionGameUser correct = session.correctUser();
        return new HackView(passwords, session.triesLeft(), correct.userName(), correct.passwordHint(),
                session.stationId());
    }
}
