package com.phillippitts.worktracker.service.store;

import com.phillippitts.worktracker.domain.ExitResolution;
import com.phillippitts.worktracker.domain.IgnoreReason;
import com.phillippitts.worktracker.domain.LocationTransition;
import com.phillippitts.worktracker.domain.SessionState;
import com.phillippitts.worktracker.domain.TrackingMethod;
import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.domain.TransitionEvent;
import com.phillippitts.worktracker.exception.PersistenceException;
import com.phillippitts.worktracker.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTrackingStoreTest {

    private static final Instant T8 = Instant.parse("2025-03-03T08:00:00Z");

    private MutableClock clock;
    private InMemoryTrackingStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T8);
        store = new InMemoryTrackingStore(clock);
    }

    private TrackingSession open(String siteId, Instant clockIn) {
        return store.createSession(new NewSession(siteId, clockIn, TrackingMethod.AUTO, 12.0));
    }

    @Test
    void createdSessionIsActiveAndRetrievable() {
        TrackingSession s = open("hq", T8);

        assertThat(s.state()).isEqualTo(SessionState.ACTIVE);
        assertThat(s.createdAt()).isEqualTo(T8);
        assertThat(store.getSession(s.id())).contains(s);
        assertThat(store.getActiveOrPendingSession("hq")).contains(s);
    }

    @Test
    void refusesSecondOpenSessionForSameSite() {
        open("hq", T8);

        assertThatThrownBy(() -> open("hq", T8.plusSeconds(60)))
                .isInstanceOf(PersistenceException.class)
                .satisfies(e -> assertThat(((PersistenceException) e).getOperation()).isEqualTo("createSession"));
    }

    @Test
    void allowsOpenSessionsAtDifferentSites() {
        open("hq", T8);
        open("depot", T8);

        assertThat(store.getActiveOrPendingSession("depot")).isPresent();
    }

    @Test
    void lifecyclePatchesMoveSessionThroughStates() {
        TrackingSession s = open("hq", T8);
        clock.advance(Duration.ofHours(8));

        TrackingSession pending = store.updateSession(s.id(), SessionPatch.pendingExit(T8.plusSeconds(28_800), 70.0));
        assertThat(pending.state()).isEqualTo(SessionState.PENDING_EXIT);
        assertThat(pending.exitAccuracy()).isEqualTo(70.0);
        assertThat(pending.updatedAt()).isEqualTo(clock.instant());

        TrackingSession back = store.updateSession(s.id(), SessionPatch.reactivate());
        assertThat(back.state()).isEqualTo(SessionState.ACTIVE);
        assertThat(back.pendingExitAt()).isNull();
        assertThat(back.exitAccuracy()).isNull();
        assertThat(back.clockIn()).isEqualTo(T8);

        store.updateSession(s.id(), SessionPatch.pendingExit(T8.plusSeconds(28_900), 70.0));
        TrackingSession done = store.updateSession(s.id(),
                SessionPatch.complete(T8.plusSeconds(29_100), null, 485, ExitResolution.EXIT_BY_DEFAULT, false));
        assertThat(done.state()).isEqualTo(SessionState.COMPLETED);
        assertThat(done.exitAccuracy()).isEqualTo(70.0);
        assertThat(done.pendingExitAt()).isNull();
        assertThat(store.getActiveOrPendingSession("hq")).isEmpty();
    }

    @Test
    void invalidPatchIsRejectedAndLeavesSessionIntact() {
        TrackingSession s = open("hq", T8);

        assertThatThrownBy(() -> store.updateSession(s.id(),
                SessionPatch.complete(T8.minusSeconds(60), null, 0, ExitResolution.MANUAL, true)))
                .isInstanceOf(PersistenceException.class);

        assertThat(store.getSession(s.id())).contains(s);
    }

    @Test
    void updateOfUnknownSessionFails() {
        assertThatThrownBy(() -> store.updateSession("missing", SessionPatch.reactivate()))
                .isInstanceOf(PersistenceException.class);
    }

    @Test
    void historyIsNewestFirstAndLimited() {
        TrackingSession first = open("hq", T8);
        store.updateSession(first.id(), SessionPatch.complete(T8.plusSeconds(600), 5.0, 10, ExitResolution.IMMEDIATE, false));
        TrackingSession second = open("hq", T8.plusSeconds(3600));

        assertThat(store.queryHistory("hq", 10)).extracting(TrackingSession::id)
                .containsExactly(second.id(), first.id());
        assertThat(store.queryHistory("hq", 1)).extracting(TrackingSession::id).containsExactly(second.id());
    }

    @Test
    void overlapQueryTreatsOpenSessionsAsRunning() {
        TrackingSession morning = open("hq", T8);
        store.updateSession(morning.id(),
                SessionPatch.complete(T8.plusSeconds(4 * 3600), 5.0, 240, ExitResolution.IMMEDIATE, false));
        TrackingSession afternoon = open("hq", T8.plusSeconds(5 * 3600));

        assertThat(store.findSessionsOverlapping(T8.plusSeconds(3 * 3600), T8.plusSeconds(6 * 3600)))
                .extracting(TrackingSession::id).containsExactly(morning.id(), afternoon.id());
        assertThat(store.findSessionsOverlapping(T8.plusSeconds(4 * 3600), T8.plusSeconds(5 * 3600)))
                .isEmpty();
    }

    @Test
    void findsSessionsByState() {
        TrackingSession a = open("hq", T8);
        open("depot", T8);
        store.updateSession(a.id(), SessionPatch.pendingExit(T8.plusSeconds(60), null));

        assertThat(store.findSessionsInState(SessionState.PENDING_EXIT)).extracting(TrackingSession::id)
                .containsExactly(a.id());
    }

    @Test
    void lastAcceptedEventSkipsDebouncedRecords() {
        LocationTransition enter = LocationTransition.enter("hq", T8, 5.0);
        LocationTransition noSession = LocationTransition.exit("hq", T8.plusSeconds(20), 5.0);
        LocationTransition bounce = LocationTransition.exit("hq", T8.plusSeconds(25), 5.0);
        store.appendEvent(TransitionEvent.accepted(enter));
        store.appendEvent(TransitionEvent.ignored(noSession, IgnoreReason.NO_SESSION));
        store.appendEvent(TransitionEvent.ignored(bounce, IgnoreReason.DEBOUNCED));

        assertThat(store.findLastAcceptedEvent("hq")).get()
                .extracting(TransitionEvent::timestamp).isEqualTo(T8.plusSeconds(20));
        assertThat(store.queryEvents("hq", 2)).extracting(TransitionEvent::timestamp)
                .containsExactly(T8.plusSeconds(25), T8.plusSeconds(20));
        assertThat(store.findLastAcceptedEvent("other")).isEmpty();
    }
}
