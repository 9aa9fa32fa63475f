package com.phillippitts.worktracker.service.verification.event;

import com.phillippitts.worktracker.domain.PositionSample;
import com.phillippitts.worktracker.service.verification.VerificationVerdict;

import java.time.Instant;
import java.util.Objects;

/**
 * Published when an exit verification episode reaches a verdict.
 *
 * <p>Listeners run synchronously on the verification thread. If a listener throws, the
 * episode stays open and the verdict is delivered again by a later check or by reconciliation.
 *
 * @param sessionId     session under verification
 * @param siteId        site of the session
 * @param pendingExitAt pending exit the episode was started for
 * @param verdict       outcome
 * @param sample        deciding sample; for {@code EXHAUSTED} the last sample obtained, may be {@code null}
 * @param checkDueAt    scheduled time of the check that produced the verdict
 * @param checkNumber   1-based index of that check
 */
public record ExitVerificationCompletedEvent(
        String sessionId,
        String siteId,
        Instant pendingExitAt,
        VerificationVerdict verdict,
        PositionSample sample,
        Instant checkDueAt,
        int checkNumber
) {

    public ExitVerificationCompletedEvent {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(siteId, "siteId must not be null");
        Objects.requireNonNull(pendingExitAt, "pendingExitAt must not be null");
        Objects.requireNonNull(verdict, "verdict must not be null");
        Objects.requireNonNull(checkDueAt, "checkDueAt must not be null");
        if (verdict != VerificationVerdict.EXHAUSTED && sample == null) {
            throw new IllegalArgumentException("sample is required for verdict " + verdict);
        }
    }
}
