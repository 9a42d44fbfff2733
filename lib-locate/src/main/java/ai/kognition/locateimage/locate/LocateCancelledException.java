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

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * <p>
 * The search saw its {@link Cancellation} become active at the start of a row and stopped.
 * </p>
 *
 * <p>
 * Whatever had been found up to that point comes along with the exception: the matches
 * accumulated by {@link Locator#findAll} (already sorted) are in {@link #getPartialMatches()}
 * and the best match seen by {@link Locator#findOne} is in {@link #getBestMatch()}.
 * </p>
 */
public class LocateCancelledException extends LocateException {
    private static final long serialVersionUID = -4450126711850190844L;

    private final String cancellationCause;
    private final transient List<Match> partialMatches;
    private final transient Match bestMatch;

    public LocateCancelledException(final String cancellationCause) {
        this(cancellationCause, Collections.emptyList(), null);
    }

    private LocateCancelledException(final String cancellationCause, final List<Match> partialMatches, final Match bestMatch) {
        super("Search cancelled: " + cancellationCause);
        this.cancellationCause = cancellationCause;
        this.partialMatches = Collections.unmodifiableList(partialMatches);
        this.bestMatch = bestMatch;
    }

    /**
     * The same cancellation carrying the matches found before it happened. It keeps this
     * exception's stack trace.
     */
    public LocateCancelledException withPartialMatches(final List<Match> matches) {
        final Match best = matches.isEmpty() ? bestMatch : matches.get(0);
        return sameTrace(new LocateCancelledException(cancellationCause, matches, best));
    }

    /**
     * The same cancellation carrying the best match found before it happened, which may be null.
     * It keeps this exception's stack trace.
     */
    public LocateCancelledException withBestMatch(final Match best) {
        return sameTrace(new LocateCancelledException(cancellationCause, best == null ? Collections.emptyList() : List.of(best), best));
    }

    private LocateCancelledException sameTrace(final LocateCancelledException ret) {
        ret.setStackTrace(getStackTrace());
        return ret;
    }

    /**
     * The reason given by the {@link Cancellation}.
     */
    public String getCancellationCause() {
        return cancellationCause;
    }

    public List<Match> getPartialMatches() {
        return partialMatches == null ? Collections.emptyList() : partialMatches;
    }

    public Optional<Match> getBestMatch() {
        return Optional.ofNullable(bestMatch);
    }
}
