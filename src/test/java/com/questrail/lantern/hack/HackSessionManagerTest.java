package com.questrail.lantern.hack;

import com.questrail.lantern.api.AttemptResult;
import com.questrail.lantern.api.ErrorKind;
import com.questrail.lantern.api.ExternalSyncException;
import com.questrail.lantern.api.HackView;
import com.questrail.lantern.api.InvalidDataException;
import com.questrail.lantern.api.NotFoundException;
import com.questrail.lantern.api.StorageException;
import com.questrail.lantern.config.HackPolicy;
import com.questrail.lantern.config.SignalPolicy;
import com.questrail.lantern.model.GameUser;
import com.questrail.lantern.model.HackSession;
import com.questrail.lantern.model.LanternRound;
import com.questrail.lantern.model.Station;
import com.questrail.lantern.observability.RecordingObservabilitySink;
import com.questrail.lantern.observability.SessionTransitionEvent;
import com.questrail.lantern.signal.SignalCalculator;
import com.questrail.lantern.signal.SignalController;
import com.questrail.lantern.store.FailingLanternStore;
import com.questrail.lantern.store.memory.InMemoryLanternStore;
import com.questrail.lantern.sync.FakeSignalSyncClient;
import com.questrail.lantern.sync.SignalReport;
import com.questrail.lantern.time.FixedWallClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HackSessionManagerTest {

    private static final String OWNER = "runner-7";

    private InMemoryLanternStore store;
    private FakeSignalSyncClient sync;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        store = new InMemoryLanternStore()
                .putStation(new Station(1, 100, true))
                .putStation(new Station(2, 100, true))
                .putStation(new Station(3, 100, true))
                .addGameUser(new GameUser(1, "alice", List.of("amberlight", "anvilstorm")))
                .addGameUser(new GameUser(1, "bob", List.of("basilwharf")))
                .addGameUser(new GameUser(1, "carol", List.of("cedarfrost", "cinderpath")))
                .addGameUser(new GameUser(2, "dave", List.of("deltawings")))
                .addGameUser(new GameUser(2, "erin", List.of("emberfield")))
                .setRound(LanternRound.inactive());
        List<String> filler = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            filler.add("filler" + i);
        }
        store.addFillerPasswords(filler);
        sync = new FakeSignalSyncClient();
        sink = new RecordingObservabilitySink();
    }

    private HackSessionManager manager(HackPolicy policy) {
        return manager(policy, new FailingLanternStore(store));
    }

    private HackSessionManager manager(HackPolicy policy, FailingLanternStore ports) {
        Random random = new Random(42);
        SignalController controller = new SignalController(ports, sync, ports,
                new SignalCalculator(SignalPolicy.defaults()), new FixedWallClock(), sink, true);
        return new HackSessionManager(ports, ports, controller,
                new SessionGenerator(random), new DecoyPayloadBuilder(random, policy.decoyCount()),
                policy, new FixedWallClock(), sink);
    }

    private HackSession stored() {
        return store.getSession(OWNER).orElseThrow();
    }

    private String correctPassword() {
        return stored().correctUser().password();
    }

    private String wrongGuess() {
        return "#" + correctPassword().substring(1);
    }

    private List<SessionTransitionEvent.Reason> reasons() {
        List<SessionTransitionEvent.Reason> out = new ArrayList<>();
        for (SessionTransitionEvent e : sink.eventsOfType(SessionTransitionEvent.class)) {
            out.add(e.reason());
        }
        return out;
    }

    @Test
    void firstRequestCreatesSession() {
        HackView view = manager(HackPolicy.defaults()).getOrCreateSession(OWNER, 1);

        assertEquals(15, view.passwords().size());
        assertEquals(3, view.triesLeft());
        assertEquals(1, view.stationId());

        HackSession session = stored();
        assertEquals(session.correctUser().userName(), view.userName());
        assertEquals(session.correctUser().passwordHint(), view.passwordHint());
        assertTrue(view.passwords().contains(session.correctUser().password()));
        assertEquals(List.of(SessionTransitionEvent.Reason.CREATED), reasons());
    }

    @Test
    void sameStationReusesSession() {
        HackSessionManager manager = manager(HackPolicy.defaults());
        HackView first = manager.getOrCreateSession(OWNER, 1);
        HackSession before = stored();

        HackView second = manager.getOrCreateSession(OWNER, 1);

        assertEquals(before, stored());
        assertEquals(first.userName(), second.userName());
        assertEquals(first.passwordHint(), second.passwordHint());
        assertEquals(first.passwords().subList(13, 15), second.passwords().subList(13, 15));
        assertEquals(List.of(SessionTransitionEvent.Reason.CREATED, SessionTransitionEvent.Reason.REUSED), reasons());
    }

    @Test
    void reuseKeepsConsumedTries() {
        HackSessionManager manager = manager(HackPolicy.defaults());
        manager.getOrCreateSession(OWNER, 1);
        manager.attempt(OWNER, wrongGuess(), true);

        assertEquals(2, manager.getOrCreateSession(OWNER, 1).triesLeft());
    }

    @Test
    void otherStationSupersedesSession() {
        HackSessionManager manager = manager(HackPolicy.defaults());
        manager.getOrCreateSession(OWNER, 1);
        manager.attempt(OWNER, wrongGuess(), true);

        HackView view = manager.getOrCreateSession(OWNER, 2);

        assertEquals(2, stored().stationId());
        assertEquals(3, view.triesLeft());
        assertTrue(List.of("dave", "erin").contains(view.userName()));
        assertEquals(List.of(SessionTransitionEvent.Reason.CREATED, SessionTransitionEvent.Reason.SUPERSEDED), reasons());
    }

    @Test
    void stationWithoutGameUsersIsNotFound() {
        assertThrows(NotFoundException.class, () -> manager(HackPolicy.defaults()).getOrCreateSession(OWNER, 3));
        assertTrue(store.getSession(OWNER).isEmpty());
    }

    @Test
    void wrongGuessReportsMatchesAndConsumesTry() {
        HackSessionManager manager = manager(HackPolicy.defaults());
        manager.getOrCreateSession(OWNER, 1);
        String guess = wrongGuess();

        AttemptResult result = manager.attempt(OWNER, guess, true);

        assertFalse(result.success());
        assertTrue(result.boostingSignal());
        assertEquals(2, result.triesLeft());
        assertEquals(guess.length() - 1, result.matches().orElseThrow());
        assertEquals(2, stored().triesLeft());
        assertTrue(sync.pushed().isEmpty());
    }

    @Test
    void lastWrongGuessTerminatesSession() {
        HackSessionManager manager = manager(HackPolicy.defaults().withTriesBudget(2));
        manager.getOrCreateSession(OWNER, 1);
        String guess = wrongGuess();

        assertEquals(1, manager.attempt(OWNER, guess, false).triesLeft());
        AttemptResult last = manager.attempt(OWNER, guess, false);

        assertFalse(last.success());
        assertEquals(0, last.triesLeft());
        assertTrue(last.matches().isEmpty());
        assertTrue(store.getSession(OWNER).isEmpty());
        assertEquals(100, store.getStation(1).orElseThrow().signalValue());
        assertTrue(reasons().contains(SessionTransitionEvent.Reason.EXHAUSTED));
    }

    @Test
    void correctGuessAdjustsSignalAndEndsSession() {
        HackSessionManager manager = manager(HackPolicy.defaults());
        manager.getOrCreateSession(OWNER, 1);

        AttemptResult result = manager.attempt(OWNER, correctPassword().toUpperCase(), true);

        assertTrue(result.success());
        assertTrue(result.boostingSignal());
        assertEquals(110, store.getStation(1).orElseThrow().signalValue());
        assertEquals(List.of(new SignalReport(1, 110)), sync.pushed());
        assertTrue(store.getSession(OWNER).isEmpty());
        assertTrue(reasons().contains(SessionTransitionEvent.Reason.SUCCEEDED));
    }

    @Test
    void correctGuessCanSuppress() {
        HackSessionManager manager = manager(HackPolicy.defaults());
        manager.getOrCreateSession(OWNER, 1);
        manager.attempt(OWNER, wrongGuess(), false);

        AttemptResult result = manager.attempt(OWNER, correctPassword(), false);

        assertTrue(result.success());
        assertFalse(result.boostingSignal());
        assertEquals(90, store.getStation(1).orElseThrow().signalValue());
    }

    @Test
    void externalFailureLeavesSessionForRetry() {
        HackSessionManager manager = manager(HackPolicy.defaults());
        manager.getOrCreateSession(OWNER, 1);
        HackSession before = stored();
        sync.failWith(ExternalSyncException.transport("scoring service down", null));

        ExternalSyncException e = assertThrows(ExternalSyncException.class,
                () -> manager.attempt(OWNER, before.correctUser().password(), true));

        assertEquals(ErrorKind.EXTERNAL, e.kind());
        assertEquals(before, stored());
        // the signal write is not rolled back
        assertEquals(110, store.getStation(1).orElseThrow().signalValue());
    }

    @Test
    void attemptWithoutSessionIsNotFound() {
        assertThrows(NotFoundException.class, () -> manager(HackPolicy.defaults()).attempt(OWNER, "anything", true));
    }

    @Test
    void blankOwnerOrMissingGuessIsInvalid() {
        HackSessionManager manager = manager(HackPolicy.defaults());

        assertThrows(InvalidDataException.class, () -> manager.getOrCreateSession(" ", 1));
        assertThrows(InvalidDataException.class, () -> manager.attempt(OWNER, null, true));
    }

    @Test
    void concurrentGuessesFromOneOwnerAreSerialized() throws Exception {
        HackSessionManager manager = manager(HackPolicy.defaults());
        manager.getOrCreateSession(OWNER, 1);
        String guess = wrongGuess();

        ExecutorService pool = Executors.newFixedThreadPool(3);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<AttemptResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 3; i++) {
                Callable<AttemptResult> task = () -> {
                    go.await();
                    return manager.attempt(OWNER, guess, true);
                };
                futures.add(pool.submit(task));
            }
            go.countDown();

            List<Integer> triesLeft = new ArrayList<>();
            for (Future<AttemptResult> f : futures) {
                triesLeft.add(f.get(5, TimeUnit.SECONDS).triesLeft());
            }
            triesLeft.sort(null);
            assertEquals(List.of(0, 1, 2), triesLeft);
        } finally {
            pool.shutdownNow();
        }
        assertTrue(store.getSession(OWNER).isEmpty());
    }

    @Test
    void failedSessionLookupIsStorageError() {
        FailingLanternStore ports = new FailingLanternStore(store);
        HackSessionManager manager = manager(HackPolicy.defaults(), ports);
        manager.getOrCreateSession(OWNER, 1);
        HackSession before = stored();

        ports.failOn(FailingLanternStore.Operation.GET_SESSION);

        assertThrows(StorageException.class, () -> manager.attempt(OWNER, "anything", true));
        assertThrows(StorageException.class, () -> manager.getOrCreateSession(OWNER, 2));
        assertEquals(before, stored());
    }

    @Test
    void failedDecrementLeavesTriesUntouched() {
        FailingLanternStore ports = new FailingLanternStore(store);
        HackSessionManager manager = manager(HackPolicy.defaults(), ports);
        manager.getOrCreateSession(OWNER, 1);
        HackSession before = stored();
        String guess = wrongGuess();

        ports.failOn(FailingLanternStore.Operation.UPSERT_SESSION);
        assertThrows(StorageException.class, () -> manager.attempt(OWNER, guess, true));
        assertEquals(before, stored());

        ports.recover();
        assertEquals(2, manager.attempt(OWNER, guess, true).triesLeft());
    }

    @Test
    void failedTerminationKeepsSession() {
        FailingLanternStore ports = new FailingLanternStore(store);
        HackSessionManager manager = manager(HackPolicy.defaults().withTriesBudget(1), ports);
        manager.getOrCreateSession(OWNER, 1);
        HackSession before = stored();

        ports.failOn(FailingLanternStore.Operation.DELETE_SESSION);

        assertThrows(StorageException.class, () -> manager.attempt(OWNER, wrongGuess(), true));
        assertEquals(before, stored());
        assertFalse(reasons().contains(SessionTransitionEvent.Reason.EXHAUSTED));
    }

    @Test
    void failedSignalWriteOnCorrectGuessConsumesNoTry() {
        FailingLanternStore ports = new FailingLanternStore(store);
        HackSessionManager manager = manager(HackPolicy.defaults(), ports);
        manager.getOrCreateSession(OWNER, 1);
        HackSession before = stored();

        ports.failOn(FailingLanternStore.Operation.SET_SIGNAL_VALUE);

        StorageException e = assertThrows(StorageException.class,
                () -> manager.attempt(OWNER, before.correctUser().password(), true));

        assertEquals(ErrorKind.STORAGE, e.kind());
        assertEquals(before, stored());
        assertEquals(100, store.getStation(1).orElseThrow().signalValue());
        assertTrue(sync.pushed().isEmpty());

        ports.recover();
        assertTrue(manager.attempt(OWNER, before.correctUser().password(), true).success());
    }

    @Test
    void failedCandidateLookupKeepsPreviousSession() {
        FailingLanternStore ports = new FailingLanternStore(store);
        HackSessionManager manager = manager(HackPolicy.defaults(), ports);
        manager.getOrCreateSession(OWNER, 1);
        HackSession before = stored();

        ports.failOn(FailingLanternStore.Operation.GET_CANDIDATES);

        assertThrows(StorageException.class, () -> manager.getOrCreateSession(OWNER, 2));
        assertEquals(before, stored());
    }
}
