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

import java.util.Locale;

import ai.kognition.locateimage.image.geometry.Region;

/**
 * A single occurrence of a sample image within a canvas.
 */
public final class Match {
    /**
     * The number of fractional digits of a similarity (or tolerance) that are significant.
     */
    public static final int SIMILARITY_DIGITS = 6;

    /**
     * {@code 10^-SIMILARITY_DIGITS}. Similarities closer than this are considered equal.
     */
    public static final double SIMILARITY_PRECISION = 0.000001;

    private static final String FORMAT = "(%d,%d)+(%dx%d) %." + (SIMILARITY_DIGITS - 2) + "f%%";

    private final Region region;
    private final double similarity;

    /**
     * @param region the part of the canvas that matched. It's the same size as the sample.
     * @param similarity from 0 (completely dissimilar) to 1 (exact). A match reported for a
     *     given tolerance has a similarity of at least {@code 1 - tolerance}.
     */
    public Match(final Region region, final double similarity) {
        if(region == null)
            throw new IllegalArgumentException("A Match requires a region");
        this.region = region;
        this.similarity = similarity;
    }

    public Region getRegion() {
        return region;
    }

    public double getSimilarity() {
        return similarity;
    }

    /**
     * Whether this match sorts ahead of {@code other} according to {@link MatchOrder}.
     */
    public boolean before(final Match other) {
        return MatchOrder.INSTANCE.compare(this, other) < 0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, FORMAT, region.getX(), region.getY(), region.getWidth(), region.getHeight(), 100.0 * similarity);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + region.hashCode();
        final long temp = Double.doubleToLongBits(similarity);
        result = prime * result + (int)(temp ^ (temp >>> 32));
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final Match other = (Match)obj;
        if(Double.doubleToLongBits(similarity) != Double.doubleToLongBits(other.similarity)) return false;
        return region.equals(other.region);
    }
}
