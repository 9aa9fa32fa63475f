package com.phillippitts.worktracker.service.tracking;

import com.phillippitts.worktracker.domain.ExitResolution;
import com.phillippitts.worktracker.domain.TrackingMethod;
import com.phillippitts.worktracker.domain.TrackingSession;
import com.phillippitts.worktracker.service.store.InMemoryTrackingStore;
import com.phillippitts.worktracker.service.store.NewSession;
import com.phillippitts.worktracker.service.store.SessionPatch;
import com.phillippitts.worktracker.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionQueryServiceTest {

    private static final Instant DAY = Instant.parse("2025-03-03T00:00:00Z");

    private InMemoryTrackingStore store;
    private SessionQueryService queries;

    @BeforeEach
    void setUp() {
        store = new InMemoryTrackingStore(new MutableClock(DAY));
        queries = new SessionQueryService(store);
    }

    @Test
    void overlapQueryLeavesOutShortSessionsButKeepsOpenOnes() {
        TrackingSession workday = completed("hq", "08:00", "17:00", 540, false);
        completed("hq", "17:30", "17:33", 3, true);
        TrackingSession open = store.createSession(new NewSession("depot", at("18:00"), TrackingMethod.AUTO, 10.0));

        assertThat(queries.getSessionsOverlapping(DAY, DAY.plusSeconds(86_400)))
                .extracting(TrackingSession::id)
                .containsExactly(workday.id(), open.id());
    }

    @Test
    void overlapQueryIsHalfOpen() {
        completed("hq", "08:00", "12:00", 240, false);

        assertThat(queries.getSessionsOverlapping(at("12:00"), at("13:00"))).isEmpty();
        assertThat(queries.getSessionsOverlapping(at("11:59"), at("12:00"))).hasSize(1);
    }

    @Test
    void rejectsEmptyOrInvertedRange() {
        assertThatThrownBy(() -> queries.getSessionsOverlapping(at("10:00"), at("10:00")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queries.getSessionsOverlapping(at("11:00"), at("10:00")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void historyIncludesShortSessions() {
        completed("hq", "08:00", "08:02", 2, true);

        assertThat(queries.history("hq", 10)).singleElement()
                .satisfies(s -> assertThat(s.shortSession()).isTrue());
    }

    @Test
    void activeSessionReturnsOpenSessionOnly() {
        completed("hq", "08:00", "09:00", 60, false);
        assertThat(queries.getActiveSession("hq")).isEmpty();

        store.createSession(new NewSession("hq", at("10:00"), TrackingMethod.MANUAL, null));
        assertThat(queries.getActiveSession("hq")).isPresent();
    }

    @Test
    void limitMustBePositiveAndIsCapped() {
        for (int i = 0; i < 3; i++) {
            completed("hq", "0" + (i + 1) + ":00", "0" + (i + 1) + ":30", 30, false);
        }

        assertThat(queries.history("hq", SessionQueryService.MAX_LIMIT * 10)).hasSize(3);
        assertThatThrownBy(() -> queries.history("hq", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queries.events("hq", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    private TrackingSession completed(String siteId, String in, String out, long minutes, boolean shortSession) {
        TrackingSession open = store.createSession(new NewSession(siteId, at(in), TrackingMethod.AUTO, null));
        return store.updateSession(open.id(),
                SessionPatch.complete(at(out), null, minutes, ExitResolution.IMMEDIATE, shortSession));
    }

    private static Instant at(String hhmm) {
        return Instant.parse("2025-03-03T" + hhmm + ":00Z");
    }
}
