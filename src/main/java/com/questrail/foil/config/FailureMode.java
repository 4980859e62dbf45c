package com.questrail.foil.config;

/** What a strategy does with a periodic job after one of its runs throws. */
public enum FailureMode {
    /** Report the failure and stop running the job. */
    SUPPRESS_FURTHER,
    /** Report the failure and keep running the job. */
    CONTINUE
}
