package com.questrail.lantern.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HackSessionTest {

    private static SessionGameUser user(String name, boolean correct) {
        return new SessionGameUser(name, name + "pw", new PasswordHint(0, name.charAt(0)), correct);
    }

    @Test
    void requiresExactlyOneCorrectUser() {
        assertThrows(IllegalArgumentException.class,
                () -> new HackSession("o", 1, List.of(user("a", false), user("b", false)), 3));
        assertThrows(IllegalArgumentException.class,
                () -> new HackSession("o", 1, List.of(user("a", true), user("b", true)), 3));
    }

    @Test
    void consumingTriesNeverGoesNegative() {
        HackSession session = new HackSession("o", 1, List.of(user("a", true)), 1);

        HackSession once = session.withTryConsumed();
        assertEquals(0, once.triesLeft());
        assertEquals(0, once.withTryConsumed().triesLeft());
        assertEquals(1, session.triesLeft());
    }

    @Test
    void toStringHidesPasswords() {
        HackSession session = new HackSession("o", 1, List.of(user("alice", true)), 2);

        assertFalse(session.toString().contains("alicepw"));
    }

    @Test
    void hintPointsIntoPassword() {
        assertEquals(new PasswordHint(2, 'n'), PasswordHint.of("lantern", 2));
    }

    @Test
    void gameUserNeedsPasswords() {
        assertThrows(IllegalArgumentException.class, () -> new GameUser(1, "alice", List.of()));
    }

    @Test
    void gameUserRejectsEmptyOrMissingPassword() {
        assertThrows(IllegalArgumentException.class, () -> new GameUser(1, "ghost", List.of("")));
        assertThrows(IllegalArgumentException.class, () -> new GameUser(1, "ghost", List.of("amber", "")));
        assertThrows(NullPointerException.class, () -> new GameUser(1, "ghost", Arrays.asList("amber", null)));
    }
}
