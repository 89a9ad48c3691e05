package dev.codescope.search;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-request time budget, created once when a search starts and passed to every stage that may
 * block. Stages ask for {@link #remaining()} instead of re-reading the clock against their own
 * start time.
 *
 * @param startedAt the instant the request started
 * @param budget the total time the request may spend before optional stages are skipped
 * @param clock the clock used to measure elapsed time
 */
public record SearchDeadline(Instant startedAt, Duration budget, Clock clock) {

  /** Starts a deadline now. */
  public static SearchDeadline start(Clock clock, Duration budget) {
    return new SearchDeadline(clock.instant(), budget, clock);
  }

  public Duration elapsed() {
    Duration elapsed = Duration.between(startedAt, clock.instant());
    return elapsed.isNegative() ? Duration.ZERO : elapsed;
  }

  /** Time left before the budget is exhausted; never negative. */
  public Duration remaining() {
    Duration remaining = budget.minus(elapsed());
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  public boolean isExpired() {
    return remaining().isZero();
  }
}
