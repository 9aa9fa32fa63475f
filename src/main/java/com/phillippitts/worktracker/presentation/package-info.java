/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on the service layer, never the reverse.
 *
 * <ul>
 *   <li>{@code presentation.controller} - device-facing and admin endpoints</li>
 *   <li>{@code presentation.exception} - translation of domain exceptions to HTTP responses</li>
 * </ul>
 */
package com.phillippitts.worktracker.presentation;
