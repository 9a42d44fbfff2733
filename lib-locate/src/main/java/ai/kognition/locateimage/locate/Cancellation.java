/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.locateimage.locate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * <p>
 * A cooperative cancellation signal. The scanner polls it at the start of every row of candidate
 * positions, so once it's active the scan ends within one row's worth of comparisons.
 * </p>
 *
 * <p>
 * There are no timeouts in the scanner itself. A deadline is just a {@link Cancellation} that becomes
 * active on its own, see {@link #withTimeout(Duration)}.
 * </p>
 */
public interface Cancellation {
    public static final String CANCELED = "canceled";
    public static final String DEADLINE_EXCEEDED = "deadline exceeded";

    /**
     * A {@link Cancellation} that's never active.
     */
    public static final Cancellation NONE = new Cancellation() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public String cause() {
            return null;
        }

        @Override
        public String toString() {
            return "Cancellation.NONE";
        }
    };

    public boolean isCancelled();

    /**
     * Why this was cancelled, or null if it isn't.
     */
    public String cause();

    /**
     * Active when either this or {@code other} is. The cause reported is from whichever is
     * active, this one first.
     */
    public default Cancellation or(final Cancellation other) {
        if(other == null || other == NONE)
            return this;
        if(this == NONE)
            return other;

        final Cancellation self = this;
        return new Cancellation() {
            @Override
            public boolean isCancelled() {
                return self.isCancelled() || other.isCancelled();
            }

            @Override
            public String cause() {
                final String ret = self.cause();
                return ret != null ? ret : other.cause();
            }
        };
    }

    public static Cancellation withTimeout(final Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static Cancellation withTimeout(final Duration timeout, final Clock clock) {
        return withDeadline(clock.instant().plus(timeout), clock);
    }

    public static Cancellation withDeadline(final Instant deadline) {
        return withDeadline(deadline, Clock.systemUTC());
    }

    /**
     * Active once {@code clock} reaches {@code deadline}.
     */
    public static Cancellation withDeadline(final Instant deadline, final Clock clock) {
        return new Cancellation() {
            @Override
            public boolean isCancelled() {
                return !clock.instant().isBefore(deadline);
            }

            @Override
            public String cause() {
                return isCancelled() ? DEADLINE_EXCEEDED : null;
            }

            @Override
            public String toString() {
                return "Cancellation at " + deadline;
            }
        };
    }
}
