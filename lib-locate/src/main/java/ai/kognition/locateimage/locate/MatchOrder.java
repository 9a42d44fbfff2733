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

import static ai.kognition.locateimage.locate.Match.SIMILARITY_PRECISION;

import java.util.Comparator;
import java.util.List;

/**
 * <p>
 * The order matches are reported in. Higher similarity matches come before lower similarity
 * matches. Matches whose similarities are within {@link Match#SIMILARITY_PRECISION} of each other
 * are ordered by the top of their region, then by the left, ascending.
 * </p>
 *
 * <p>
 * Because of the precision window this comparison isn't transitive (a ~ b and b ~ c doesn't make
 * a ~ c) so it shouldn't be handed to {@link List#sort(Comparator)} directly. Use {@link #sort(List)}.
 * </p>
 */
public final class MatchOrder implements Comparator<Match> {
    public static final MatchOrder INSTANCE = new MatchOrder();

    private MatchOrder() {}

    @Override
    public int compare(final Match a, final Match b) {
        final double diff = a.getSimilarity() - b.getSimilarity();
        if(Math.abs(diff) >= SIMILARITY_PRECISION)
            return diff > 0 ? -1 : 1;

        final int dy = Integer.compare(a.getRegion().getY(), b.getRegion().getY());
        if(dy != 0)
            return dy;
        return Integer.compare(a.getRegion().getX(), b.getRegion().getX());
    }

    /**
     * <p>
     * Sort the list in place so that for every adjacent pair {@code (a, b)} either
     * {@code a.before(b)} or neither is before the other. Returns the same list.
     * </p>
     *
     * <p>
     * This is a merge sort that compares every pair it places next to each other. Since the
     * comparison is antisymmetric that's enough to keep each adjacent pair in order even without
     * transitivity. It takes {@code O(n log n)} comparisons.
     * </p>
     */
    public static List<Match> sort(final List<Match> matches) {
        final int n = matches.size();
        if(n < 2)
            return matches;

        Match[] src = matches.toArray(new Match[n]);
        Match[] dst = new Match[n];
        for(int width = 1; width < n; width *= 2) {
            for(int lo = 0; lo < n; lo += 2 * width) {
                final int mid = Math.min(lo + width, n);
                final int hi = Math.min(lo + (2 * width), n);
                merge(src, lo, mid, hi, dst);
            }
            final Match[] tmp = src;
            src = dst;
            dst = tmp;
        }

        for(int i = 0; i < n; i++)
            matches.set(i, src[i]);
        return matches;
    }

    // The left run wins unless the head of the right run is strictly before it.
    private static void merge(final Match[] src, final int lo, final int mid, final int hi, final Match[] dst) {
        int l = lo;
        int r = mid;
        for(int d = lo; d < hi; d++) {
            if(r >= hi || (l < mid && INSTANCE.compare(src[r], src[l]) >= 0))
                dst[d] = src[l++];
            else
                dst[d] = src[r++];
        }
    }
}
