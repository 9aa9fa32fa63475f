/**
 * Work-session lifecycle: state machine, read-side queries and startup wiring.
 */
package com.phillippitts.worktracker.service.tracking;
