package com.phillippitts.worktracker.service.tracking;

import com.phillippitts.worktracker.domain.LocationTransition;
import com.phillippitts.worktracker.exception.PersistenceException;
import com.phillippitts.worktracker.service.site.SiteService;
import com.phillippitts.worktracker.testutil.FakeLocationCapability;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TrackingLifecycleTest {

    private SessionStateMachine stateMachine;
    private SiteService siteService;
    private FakeLocationCapability location;
    private TrackingLifecycle lifecycle;

    @BeforeEach
    void setUp() {
        stateMachine = mock(SessionStateMachine.class);
        siteService = mock(SiteService.class);
        location = new FakeLocationCapability();
        lifecycle = new TrackingLifecycle(stateMachine, location, siteService);
    }

    @Test
    void listenerRoutesTransitionsToStateMachine() {
        lifecycle.wireListener();
        LocationTransition enter = LocationTransition.enter("hq", Instant.parse("2025-03-03T08:00:00Z"), 10.0);

        location.listener().onTransition(enter);

        verify(stateMachine).handleTransition(enter);
    }

    @Test
    void readyRegistersMonitorsBeforeReconciling() {
        when(stateMachine.reconcilePendingExits()).thenReturn(2);

        lifecycle.onReady();

        InOrder order = inOrder(siteService, stateMachine);
        order.verify(siteService).registerActiveMonitors();
        order.verify(stateMachine).reconcilePendingExits();
    }

    @Test
    void sweepFailureIsContained() {
        when(stateMachine.reconcilePendingExits())
                .thenThrow(new PersistenceException("findSessionsInState", "store offline"));

        assertThatCode(() -> lifecycle.sweep()).doesNotThrowAnyException();
        assertThat(location.listener()).isNull();
        verify(stateMachine).reconcilePendingExits();
        verify(stateMachine, never()).handleTransition(any());
    }
}
