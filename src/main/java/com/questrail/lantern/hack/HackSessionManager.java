package com.questrail.lantern.hack;

import com.questrail.lantern.api.AttemptResult;
import com.questrail.lantern.api.HackView;
import com.questrail.lantern.api.InvalidDataException;
import com.questrail.lantern.api.NotFoundException;
import com.questrail.lantern.config.HackPolicy;
import com.questrail.lantern.internal.concurrent.KeyedLocks;
import com.questrail.lantern.internal.time.WallClock;
import com.questrail.lantern.model.HackSession;
import com.questrail.lantern.model.SessionGameUser;
import com.questrail.lantern.observability.LanternObservabilitySink;
import com.questrail.lantern.observability.NullObservabilitySink;
import com.questrail.lantern.observability.SessionTransitionEvent;
import com.questrail.lantern.signal.AdjustmentOutcome;
import com.questrail.lantern.signal.SignalController;
import com.questrail.lantern.store.CandidatePool;
import com.questrail.lantern.store.HackSessionStore;

import java.util.Objects;
import java.util.Optional;

/**
 * HackSessionManager
 * =============================================================================
 * Lifecycle of per-owner hack sessions.
 *
 * <h2>Session state machine</h2>
 * <pre>
 *   NoSession ──request(s)──▶ ActiveSession(s)
 *   ActiveSession(s) ──request(s)──▶ ActiveSession(s)       (reused, unchanged)
 *   ActiveSession(s) ──request(t≠s)──▶ ActiveSession(t)     (superseded)
 *   ActiveSession(s) ──correct guess──▶ NoSession           (signal adjusted)
 *   ActiveSession(s) ──wrong guess, tries→0──▶ NoSession    (exhausted)
 * </pre>
 *
 * <h2>Threading model</h2>
 * Every operation for one owner runs under that owner's lock, so two
 * concurrent attempts can never both see the same {@code triesLeft}.
 *
 * <h2>Failure semantics</h2>
 * A store failure leaves the session as it was before the call. A correct
 * guess whose signal push fails is reported as
 * {@link com.questrail.lantern.api.ExternalSyncException} and consumes no
 * try; the station value has nevertheless been written.
 */
public final class HackSessionManager
{
    private final HackSessionStore sessions;
    private final CandidatePool candidates;
    private final SignalController signalController;
    private final SessionGenerator generator;
    private final DecoyPayloadBuilder payloadBuilder;
    private final HackPolicy policy;
    private final WallClock wallClock;
    private final LanternObservabilitySink observabilitySink;

    private final KeyedLocks<String> ownerLocks = new KeyedLocks<>();

    public HackSessionManager(HackSessionStore sessions,
                              CandidatePool candidates,
                              SignalController signalController,
                              SessionGenerator generator,
                              DecoyPayloadBuilder payloadBuilder,
                              HackPolicy policy,
                              WallClock wallClock,
                              LanternObservabilitySink observabilitySink)
    {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.candidates = Objects.requireNonNull(candidates, "candidates");
        this.signalController = Objects.requireNonNull(signalController, "signalController");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.payloadBuilder = Objects.requireNonNull(payloadBuilder, "payloadBuilder");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public HackView getOrCreateSession(String owner, int stationId) {
        requireOwner(owner);

        HackSession session = ownerLocks.withLock(owner, () -> {
            Optional<HackSession> existing = sessions.getSession(owner);
            SessionSlot from = SessionSlot.of(existing);

            switch (from.onRequest(stationId)) {
                case REUSE:
                    publish(owner, from, from, SessionTransitionEvent.Reason.REUSED);
                    return existing.orElseThrow();
                case SUPERSEDE:
                case CREATE:
                default:
                    HackSession created = generator.generate(
                            owner,
                            stationId,
                            candidates.getCandidates(stationId),
                            policy.candidatesPerSession(),
                            policy.triesBudget());
                    sessions.upsertSession(created);
                    publish(owner, from, new SessionSlot.Active(stationId),
                            from instanceof SessionSlot.Active
                                    ? SessionTransitionEvent.Reason.SUPERSEDED
                                    : SessionTransitionEvent.Reason.CREATED);
                    return created;
            }
        });

        return payloadBuilder.build(session, candidates.getFillerPasswords());
    }

    public AttemptResult attempt(String owner, String guess, boolean boosting) {
        requireOwner(owner);
        if (guess == null) {
            throw new InvalidDataException("expected { password, boostingSignal }");
        }

        return ownerLocks.withLock(owner, () -> {
            HackSession session = sessions.getSession(owner)
                    .orElseThrow(() -> new NotFoundException("hack session of " + owner));
            SessionGameUser correct = session.correctUser();
            SessionSlot from = new SessionSlot.Active(session.stationId());

            if (PasswordMatcher.isMatch(guess, correct.password()) && session.triesLeft() > 0) {
                AdjustmentOutcome outcome = signalController.adjust(session.stationId(), boosting);
                if (outcome instanceof AdjustmentOutcome.SyncFailed failed) {
                    throw failed.failure();
                }

                sessions.deleteSession(owner);
                publish(owner, from, SessionSlot.Empty.INSTANCE, SessionTransitionEvent.Reason.SUCCEEDED);
                return AttemptResult.succeeded(boosting, session.triesLeft());
            }

            HackSession lowered = session.withTryConsumed();
            if (lowered.triesLeft() <= 0) {
                sessions.deleteSession(owner);
                publish(owner, from, SessionSlot.Empty.INSTANCE, SessionTransitionEvent.Reason.EXHAUSTED);
                return AttemptResult.exhausted(boosting);
            }

            sessions.upsertSession(lowered);
            return AttemptResult.failed(boosting, lowered.triesLeft(),
                    PasswordMatcher.countMatches(guess, correct.password()));
        });
    }

    private void publish(String owner, SessionSlot from, SessionSlot to, SessionTransitionEvent.Reason reason) {
        observabilitySink.onSessionTransition(new SessionTransitionEvent(wallClock.now(), owner, from, to, reason));
    }

    private static void requireOwner(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new InvalidDataException("owner must not be blank");
        }
    }
}
