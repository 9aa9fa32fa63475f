package com.phillippitts.worktracker.service.debounce;

import com.phillippitts.worktracker.config.properties.TrackingProperties;
import com.phillippitts.worktracker.domain.IgnoreReason;
import com.phillippitts.worktracker.domain.LocationTransition;
import com.phillippitts.worktracker.domain.TransitionEvent;
import com.phillippitts.worktracker.service.store.InMemoryTrackingStore;
import com.phillippitts.worktracker.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class EventDebouncerTest {

    private static final Instant T0 = Instant.parse("2025-03-03T08:00:00Z");

    private InMemoryTrackingStore store;
    private EventDebouncer debouncer;

    @BeforeEach
    void setUp() {
        store = new InMemoryTrackingStore(new MutableClock(T0));
        debouncer = new EventDebouncer(store, new TrackingProperties());
    }

    private void acceptAndRecord(LocationTransition t) {
        assertThat(debouncer.check(t).accepted()).isTrue();
        store.appendEvent(TransitionEvent.accepted(t));
        debouncer.recordAccepted(t);
    }

    @Test
    void firstTransitionForSiteIsAccepted() {
        DebounceDecision decision = debouncer.check(LocationTransition.enter("hq", T0, 10.0));

        assertThat(decision.accepted()).isTrue();
        assertThat(decision.sinceLastAccepted()).isNull();
    }

    @Test
    void rejectsAnyTransitionInsideCooldownRegardlessOfType() {
        acceptAndRecord(LocationTransition.enter("hq", T0, 10.0));

        DebounceDecision decision = debouncer.check(LocationTransition.exit("hq", T0.plusSeconds(9), 10.0));

        assertThat(decision.accepted()).isFalse();
        assertThat(decision.sinceLastAccepted()).isEqualTo(Duration.ofSeconds(9));
        assertThat(store.queryEvents("hq", 5)).first().satisfies(e -> {
            assertThat(e.ignored()).isTrue();
            assertThat(e.ignoreReason()).isEqualTo(IgnoreReason.DEBOUNCED);
        });
    }

    @Test
    void acceptsTransitionExactlyAtCooldownBoundary() {
        acceptAndRecord(LocationTransition.enter("hq", T0, 10.0));

        assertThat(debouncer.check(LocationTransition.exit("hq", T0.plusSeconds(10), 10.0)).accepted()).isTrue();
    }

    @Test
    void rejectedTransitionsDoNotExtendTheWindow() {
        acceptAndRecord(LocationTransition.enter("hq", T0, 10.0));
        debouncer.check(LocationTransition.exit("hq", T0.plusSeconds(8), 10.0));

        assertThat(debouncer.check(LocationTransition.exit("hq", T0.plusSeconds(12), 10.0)).accepted()).isTrue();
    }

    @Test
    void windowDoesNotAdvanceUntilRecorded() {
        assertThat(debouncer.check(LocationTransition.enter("hq", T0, 10.0)).accepted()).isTrue();

        // caller failed to persist: the same transition must pass again on retry
        assertThat(debouncer.check(LocationTransition.enter("hq", T0, 10.0)).accepted()).isTrue();
    }

    @Test
    void outOfOrderTransitionIsRejected() {
        acceptAndRecord(LocationTransition.enter("hq", T0, 10.0));

        assertThat(debouncer.check(LocationTransition.exit("hq", T0.minusSeconds(60), 10.0)).accepted()).isFalse();
    }

    @Test
    void sitesAreIndependent() {
        acceptAndRecord(LocationTransition.enter("hq", T0, 10.0));

        assertThat(debouncer.check(LocationTransition.enter("depot", T0.plusSeconds(1), 10.0)).accepted()).isTrue();
    }

    @Test
    void recoversWindowFromStoreAfterRestart() {
        store.appendEvent(TransitionEvent.accepted(LocationTransition.enter("hq", T0, 10.0)));
        EventDebouncer restarted = new EventDebouncer(store, new TrackingProperties());

        assertThat(restarted.check(LocationTransition.exit("hq", T0.plusSeconds(3), 10.0)).accepted()).isFalse();
        assertThat(restarted.check(LocationTransition.exit("hq", T0.plusSeconds(30), 10.0)).accepted()).isTrue();
    }

    @Test
    void debouncedEventsAreNotUsedForRecovery() {
        store.appendEvent(TransitionEvent.accepted(LocationTransition.enter("hq", T0, 10.0)));
        store.appendEvent(TransitionEvent.ignored(LocationTransition.exit("hq", T0.plusSeconds(5), 10.0),
                IgnoreReason.DEBOUNCED));
        EventDebouncer restarted = new EventDebouncer(store, new TrackingProperties());

        assertThat(restarted.check(LocationTransition.exit("hq", T0.plusSeconds(11), 10.0)).accepted()).isTrue();
    }

    @Test
    void forgetDropsCachedWindow() {
        LocationTransition enter = LocationTransition.enter("hq", T0, 10.0);
        assertThat(debouncer.check(enter).accepted()).isTrue();
        debouncer.recordAccepted(enter);

        debouncer.forget("hq");

        assertThat(debouncer.check(LocationTransition.exit("hq", T0.plusSeconds(1), 10.0)).accepted()).isTrue();
    }
}
