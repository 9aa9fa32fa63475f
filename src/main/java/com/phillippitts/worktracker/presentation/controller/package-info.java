/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/transitions} - geofence crossings pushed by the device</li>
 *   <li>{@code POST /api/positions} - periodic position reports used by exit verification</li>
 *   <li>{@code POST /api/sites/{id}/clock-in}, {@code /clock-out} - manual overrides</li>
 *   <li>{@code GET /api/sessions?from&to} - sessions overlapping a window</li>
 *   <li>{@code GET /api/sites/{id}/session}, {@code /history}, {@code /events} - per-site reads</li>
 *   <li>{@code /api/sites} - site CRUD</li>
 * </ul>
 *
 * <p>Controllers only translate HTTP to service calls; exceptions are mapped by
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.worktracker.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.worktracker.presentation.controller;
