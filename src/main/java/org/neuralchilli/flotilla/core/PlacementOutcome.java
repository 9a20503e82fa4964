package org.neuralchilli.flotilla.core;

/**
 * What became of an admitted group handed to the lifecycle state machine.
 */
public enum PlacementOutcome {
    /**
     * Every task of the group got a node
     */
    PLACED,

    /**
     * The backend refused the gang; the group goes back to its queue
     */
    REJECTED,

    /**
     * The group no longer wanted admission, e.g. its workflow was canceled meanwhile
     */
    STALE
}
