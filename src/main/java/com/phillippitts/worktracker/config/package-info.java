/**
 * Spring configuration: typed properties, thread pools for verification timers and
 * notifications, pool metrics and the injectable {@link java.time.Clock}.
 */
package com.phillippitts.worktracker.config;
