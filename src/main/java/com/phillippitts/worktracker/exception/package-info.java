/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.worktracker.exception.WorkTrackerException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.worktracker.exception.ManualCommandConflictException} - manual
 *       clock-in/out rejected because of the current session state</li>
 *   <li>{@link com.phillippitts.worktracker.exception.PersistenceException} - the tracking store
 *       did not acknowledge a read or write</li>
 *   <li>{@link com.phillippitts.worktracker.exception.InvalidTransitionException} - a raw
 *       transition payload failed boundary validation</li>
 *   <li>{@link com.phillippitts.worktracker.exception.SiteNotFoundException} and
 *       {@link com.phillippitts.worktracker.exception.InvalidSiteException} - site management errors</li>
 *   <li>{@link com.phillippitts.worktracker.exception.PositionUnavailableException} - an active
 *       position fetch failed (never surfaces over HTTP)</li>
 * </ul>
 *
 * <p>Ignored transitions and inconclusive verifications are outcomes, not exceptions.
 *
 * @see com.phillippitts.worktracker.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.worktracker.exception;
