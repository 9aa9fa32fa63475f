/**
 * Logging support: request-scoped MDC population for Log4j 2.
 */
package com.phillippitts.worktracker.config.logging;
