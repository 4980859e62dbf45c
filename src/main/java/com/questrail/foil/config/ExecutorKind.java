package com.questrail.foil.config;

/** Executor backing the runtime's strategy. */
public enum ExecutorKind {
    /** JDK {@code ScheduledThreadPoolExecutor}. */
    JDK_SCHEDULED_POOL,
    /** Netty {@code DefaultEventExecutorGroup}. */
    NETTY_EVENT_EXECUTOR
}
