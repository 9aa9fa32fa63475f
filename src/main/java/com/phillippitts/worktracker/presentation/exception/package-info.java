/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.worktracker.exception.ManualCommandConflictException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.worktracker.exception.SiteNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.worktracker.exception.InvalidTransitionException},
 *       {@link com.phillippitts.worktracker.exception.InvalidSiteException}, binding errors → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.worktracker.exception.PersistenceException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ManualCommandConflictException",
 *   "message": "ALREADY_ACTIVE",
 *   "details": "Site hq already has an open session",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.worktracker.presentation.exception;
