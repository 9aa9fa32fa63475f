package com.phillippitts.worktracker.service.location;

import com.phillippitts.worktracker.domain.LocationTransition;
import com.phillippitts.worktracker.service.tracking.TransitionOutcome;

/**
 * Callback through which a {@link LocationCapability} hands enter/exit transitions to the engine.
 */
@FunctionalInterface
public interface TransitionListener {

    /**
     * Processes one transition.
     *
     * @param transition validated transition
     * @return what the engine did with it
     */
    TransitionOutcome onTransition(LocationTransition transition);
}
