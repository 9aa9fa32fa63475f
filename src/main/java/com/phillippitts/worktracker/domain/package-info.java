/**
 * Immutable domain model of the tracking engine: sites, sessions, transitions and samples.
 *
 * <p>Records validate their own invariants in compact constructors. The session lifecycle is
 * documented on {@link com.phillippitts.worktracker.domain.SessionState}.
 *
 * @since 1.0
 */
package com.phillippitts.worktracker.domain;
