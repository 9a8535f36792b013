package com.poolintel.schedule.service;

/**
 * The run cannot produce anything meaningful, e.g. no source could be read at all.
 */
public class PipelineAbortedException extends RuntimeException {

    public PipelineAbortedException(String message) {
        super(message);
    }
}
