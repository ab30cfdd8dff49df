package com.tickwork.core;

import java.time.Instant;

/**
 * Result of one execution as applied to the job's counters.
 *
 * @param startedAt when the execution started, becomes {@code last_run_at}
 * @param success   whether the function returned normally
 * @param error     failure message, ignored on success
 * @param nextRunAt next fire time of the live timer, or null to leave the stored value
 */
public record RunOutcome(Instant startedAt, boolean success, String error, Instant nextRunAt) {
}
