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

import java.util.ArrayList;
import java.util.List;

/**
 * <p>
 * The selection policies, each a {@link MatchVisitor} that's driven by one scan. After the scan
 * {@link #result(ScanStatus)} turns what was seen into the answer (or the error), and if the scan
 * was cancelled {@link #cancelled(LocateCancelledException)} attaches what was seen so far to the
 * cancellation.
 * </p>
 *
 * <p>
 * The set of policies is closed: {@link #all()} and {@link #forSelection(Selection, String)}.
 * </p>
 */
abstract class MatchAccumulator<R> implements MatchVisitor {
    protected int count = 0;

    private MatchAccumulator() {}

    /**
     * @throws LocateException if what was seen isn't an acceptable answer.
     */
    abstract R result(ScanStatus status);

    abstract LocateCancelledException cancelled(LocateCancelledException e);

    int count() {
        return count;
    }

    static MatchAccumulator<List<Match>> all() {
        return new AllMatches();
    }

    /**
     * @param description what was searched for, used in the {@link MatchNotFoundException} message.
     */
    static MatchAccumulator<Match> forSelection(final Selection selection, final String description) {
        switch(selection) {
            case FIRST_ENCOUNTERED:
                return new FirstMatch(description);
            case BEST_OVERALL:
                return new BestMatch(false, description);
            case BEST_OVERALL_UNIQUE:
                return new BestMatch(true, description);
            default:
                throw new IllegalArgumentException("Unknown selection " + selection);
        }
    }

    /**
     * Every match, sorted with {@link MatchOrder#sort(List)}.
     */
    static final class AllMatches extends MatchAccumulator<List<Match>> {
        private final List<Match> matches = new ArrayList<>();

        @Override
        public VisitResult visit(final Match match) {
            matches.add(match);
            count++;
            return VisitResult.CONTINUE;
        }

        @Override
        List<Match> result(final ScanStatus status) {
            return MatchOrder.sort(matches);
        }

        @Override
        LocateCancelledException cancelled(final LocateCancelledException e) {
            return e.withPartialMatches(MatchOrder.sort(matches));
        }
    }

    /**
     * The first match in scan order. The scan is stopped as soon as it's seen.
     */
    static final class FirstMatch extends MatchAccumulator<Match> {
        private final String description;
        private Match first = null;

        FirstMatch(final String description) {
            this.description = description;
        }

        @Override
        public VisitResult visit(final Match match) {
            first = match;
            count++;
            return VisitResult.STOP;
        }

        @Override
        Match result(final ScanStatus status) {
            if(first == null)
                throw new MatchNotFoundException("No match for " + description);
            return first;
        }

        @Override
        LocateCancelledException cancelled(final LocateCancelledException e) {
            return e.withBestMatch(first);
        }
    }

    /**
     * The highest similarity match. On a tie the one seen first is kept. When {@code unique} is set,
     * seeing more than one match is an error that still carries the best one.
     */
    static final class BestMatch extends MatchAccumulator<Match> {
        private final boolean unique;
        private final String description;
        private Match best = null;

        BestMatch(final boolean unique, final String description) {
            this.unique = unique;
            this.description = description;
        }

        @Override
        public VisitResult visit(final Match match) {
            if(best == null || match.getSimilarity() > best.getSimilarity())
                best = match;
            count++;
            return VisitResult.CONTINUE;
        }

        @Override
        Match result(final ScanStatus status) {
            if(count == 0)
                throw new MatchNotFoundException("No match for " + description);
            if(unique && count > 1)
                throw new MultipleMatchesException(best, count);
            return best;
        }

        @Override
        LocateCancelledException cancelled(final LocateCancelledException e) {
            return e.withBestMatch(best);
        }
    }
}
