package com.poolintel.schedule.reconcile;

/**
 * A record's schedule or time text could not be turned into any session.
 * Counted as a parse error; never fatal to the run.
 */
public class UnparsableScheduleException extends Exception {

    public UnparsableScheduleException(String message) {
        super(message);
    }
}
