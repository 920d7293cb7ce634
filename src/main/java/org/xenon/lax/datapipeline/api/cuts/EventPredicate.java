package org.xenon.lax.datapipeline.api.cuts;

import org.xenon.lax.datapipeline.api.dataset.Event;

/**
 * Per-event pass/fail rule of a {@link PredicateCut}.
 */
@FunctionalInterface
public interface EventPredicate {

    /**
     * @param event cursor on the event under test
     * @return true if the event passes
     */
    boolean test(Event event);
}
