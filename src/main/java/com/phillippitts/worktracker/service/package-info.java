/**
 * Service layer of the tracking engine.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.tracking} - session state machine, queries and restart recovery</li>
 *   <li>{@code service.verification} - timed position checks that confirm or refute an exit</li>
 *   <li>{@code service.debounce} / {@code service.confidence} - transition filtering and grading</li>
 *   <li>{@code service.store} - persistence seam and the in-memory adapter</li>
 *   <li>{@code service.location} - device-facing location capability and payload parsing</li>
 *   <li>{@code service.site} - site definitions and monitor registration</li>
 *   <li>{@code service.notification}, {@code service.metrics}, {@code service.health},
 *       {@code service.events} - user feedback and operational visibility</li>
 * </ul>
 *
 * <p>Services throw domain exceptions, never HTTP ones; the presentation layer maps them.
 */
package com.phillippitts.worktracker.service;
