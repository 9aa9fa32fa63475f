/**
 * Exit verification.
 *
 * <p>An unconfirmed exit opens an episode of checks at fixed offsets after the exit. Timers
 * live only in memory; the pending exit itself is persisted, so a lost timer is recovered by
 * reconciliation rather than by the scheduler.
 */
package com.phillippitts.worktracker.service.verification;
