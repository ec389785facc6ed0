/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.ingestprep.limits;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Lets at most one caller through per interval.
 *
 * <p>Lock-free: the last pass time is kept in an {@link AtomicLong} and advanced with a single
 * compare-and-set, so when several threads poll at the same moment exactly one of them wins and
 * the rest return false without waiting. No background thread or timer is involved.
 *
 * <p>The first call after construction passes.
 *
 * @since 1.0.0
 */
public final class IntervalThrottle {

  private final long intervalNanos;
  private final LongSupplier nanoClock;
  private final AtomicLong lastPassed;

  /**
   * Creates a throttle on {@link System#nanoTime()}.
   *
   * @param interval minimum gap between two passes (must be positive)
   */
  public IntervalThrottle(Duration interval) {
    this(interval, System::nanoTime);
  }

  /**
   * Creates a throttle on a custom monotonic clock.
   *
   * @param interval minimum gap between two passes (must be positive)
   * @param nanoClock monotonic clock in nanoseconds
   */
  public IntervalThrottle(Duration interval, LongSupplier nanoClock) {
    Objects.requireNonNull(interval, "interval cannot be null");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be positive, got " + interval);
    }
    this.intervalNanos = interval.toNanos();
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock cannot be null");
    this.lastPassed = new AtomicLong(nanoClock.getAsLong() - intervalNanos);
  }

  /**
   * Non-blocking poll.
   *
   * @return true if a full interval has elapsed since the last pass and this caller won it
   */
  public boolean tryAcquire() {
    long now = nanoClock.getAsLong();
    long last = lastPassed.get();
    if (now - last < intervalNanos) {
      return false;
    }
    return lastPassed.compareAndSet(last, now);
  }

  public Duration getInterval() {
    return Duration.ofNanos(intervalNanos);
  }
}
