package com.questrail.foil.config;

/** How a strategy spaces the runs of a periodic job. */
public enum PeriodicMode {
    /** Runs start every period, measured from the initial delay. */
    FIXED_RATE,
    /** Each run starts one period after the previous run finished. */
    FIXED_DELAY
}
