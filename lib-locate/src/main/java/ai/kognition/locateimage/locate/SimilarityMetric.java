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

import static ai.kognition.locateimage.image.PixelBuffer.BLUE;
import static ai.kognition.locateimage.image.PixelBuffer.BYTES_PER_PIXEL;
import static ai.kognition.locateimage.image.PixelBuffer.GREEN;
import static ai.kognition.locateimage.image.PixelBuffer.RED;

import java.util.OptionalDouble;

import ai.kognition.locateimage.image.PixelBuffer;

/**
 * <p>
 * Compares a sample sized window of the canvas against the sample. The difference of a pair of
 * pixels is the sum of the absolute differences of their red, green and blue channels (alpha is
 * ignored). The difference of a window is the sum over all of its pixels, and its similarity is
 * {@code 1 - diff / maxTotalDiff} where {@code maxTotalDiff} is the largest difference a window of
 * the sample's size can have.
 * </p>
 *
 * <p>
 * A window is rejected outright if any single pixel differs by more than the
 * {@link #pixelThreshold(double) pixel threshold}, or once the running difference passes the
 * {@link #windowThreshold(double, int, int) window threshold}. Both are derived from the tolerance
 * when the metric is created, which happens once per search.
 * </p>
 */
public final class SimilarityMetric {
    public static final int CHANNEL_MAX = 255;
    public static final int CHANNELS_COMPARED = 3;

    /**
     * Returned by {@link #windowDiff} for a window that isn't a match.
     */
    public static final long REJECTED = -1L;

    // a single pixel is allowed twice the tolerance the window as a whole gets.
    private static final double PIXEL_TOLERANCE_FACTOR = 2.0;
    private static final int PIXEL_SCALE = CHANNELS_COMPARED * 256;

    private final double tolerance;
    private final int sampleWidth;
    private final int sampleHeight;
    private final long pixelThreshold;
    private final long windowThreshold;
    private final long maxTotalDiff;

    /**
     * @throws IllegalArgumentException if the tolerance isn't in {@code [0, 1]} or the sample
     *     dimensions are negative.
     */
    public SimilarityMetric(final double tolerance, final int sampleWidth, final int sampleHeight) {
        checkTolerance(tolerance);
        if(sampleWidth < 0 || sampleHeight < 0)
            throw new IllegalArgumentException("Invalid sample dimensions " + sampleWidth + " x " + sampleHeight);

        this.tolerance = tolerance;
        this.sampleWidth = sampleWidth;
        this.sampleHeight = sampleHeight;
        this.pixelThreshold = pixelThreshold(tolerance);
        this.windowThreshold = windowThreshold(tolerance, sampleWidth, sampleHeight);
        this.maxTotalDiff = maxTotalDiff(sampleWidth, sampleHeight);
    }

    public static void checkTolerance(final double tolerance) {
        if(!(tolerance >= 0.0 && tolerance <= 1.0))
            throw new IllegalArgumentException("The tolerance must be between 0 and 1 inclusive but was " + tolerance);
    }

    /**
     * The largest sum of channel differences a single pixel pair may have:
     * {@code round(3 * 256 * 2 * tolerance)}.
     */
    public static long pixelThreshold(final double tolerance) {
        return roundHalfUp(PIXEL_SCALE * (PIXEL_TOLERANCE_FACTOR * tolerance));
    }

    /**
     * The largest total difference a window may have:
     * {@code round(tolerance * width * height * 3 * 255)}.
     */
    public static long windowThreshold(final double tolerance, final int sampleWidth, final int sampleHeight) {
        return roundHalfUp(tolerance * maxTotalDiff(sampleWidth, sampleHeight));
    }

    public static long maxTotalDiff(final int sampleWidth, final int sampleHeight) {
        return (long)sampleWidth * (long)sampleHeight * CHANNELS_COMPARED * CHANNEL_MAX;
    }

    private static long roundHalfUp(final double value) {
        return (long)(value + 0.5);
    }

    public double getTolerance() {
        return tolerance;
    }

    public long getPixelThreshold() {
        return pixelThreshold;
    }

    public long getWindowThreshold() {
        return windowThreshold;
    }

    public long getMaxTotalDiff() {
        return maxTotalDiff;
    }

    /**
     * <p>
     * The total difference between the sample and the canvas window whose top left pixel's
     * red channel is at {@code canvasIndex}, or {@link #REJECTED}. The pixels are visited in
     * row major order and both thresholds are checked after each one.
     * </p>
     *
     * <p>
     * The indexes and strides are into the raw RGBA arrays, see {@link PixelBuffer#data()}. No
     * bounds checking is done beyond the array's own.
     * </p>
     */
    public long windowDiff(final byte[] canvas, final int canvasIndex, final int canvasStride, final byte[] sample, final int sampleIndex,
        final int sampleStride) {
        final int rowBytes = sampleWidth * BYTES_PER_PIXEL;
        long diff = 0;
        int canvasRow = canvasIndex;
        int sampleRow = sampleIndex;
        for(int row = 0; row < sampleHeight; row++) {
            int ic = canvasRow;
            int is = sampleRow;
            final int isEnd = sampleRow + rowBytes;
            while(is < isEnd) {
                final int delta = Math.abs((canvas[ic + RED] & 0xff) - (sample[is + RED] & 0xff))
                    + Math.abs((canvas[ic + GREEN] & 0xff) - (sample[is + GREEN] & 0xff))
                    + Math.abs((canvas[ic + BLUE] & 0xff) - (sample[is + BLUE] & 0xff));
                if(delta > pixelThreshold)
                    return REJECTED;
                diff += delta;
                if(diff > windowThreshold)
                    return REJECTED;

                ic += BYTES_PER_PIXEL;
                is += BYTES_PER_PIXEL;
            }
            canvasRow += canvasStride;
            sampleRow += sampleStride;
        }
        return diff;
    }

    public double similarity(final long diff) {
        return 1.0 - ((double)diff / (double)maxTotalDiff);
    }

    /**
     * Compare the sample with the canvas window whose top left corner is at ({@code x}, {@code y})
     * in the canvas' coordinates. Empty if the window is rejected.
     *
     * @throws IllegalArgumentException if the sample isn't the size this metric was made for or the
     *     window doesn't fit in the canvas.
     */
    public OptionalDouble similarityAt(final PixelBuffer canvas, final int x, final int y, final PixelBuffer sample) {
        if(sample.width() != sampleWidth || sample.height() != sampleHeight)
            throw new IllegalArgumentException("This metric compares " + sampleWidth + " x " + sampleHeight + " samples, not " + sample.width() + " x "
                + sample.height());
        if(sample.isEmpty() || x < canvas.minX() || y < canvas.minY() || x + sampleWidth > canvas.bounds().maxX()
            || y + sampleHeight > canvas.bounds().maxY())
            throw new IllegalArgumentException("A " + sampleWidth + " x " + sampleHeight + " window at (" + x + "," + y + ") isn't within " + canvas.bounds());

        final long diff = windowDiff(canvas.data(), canvas.indexOf(x, y), canvas.stride(), sample.data(), sample.offset(), sample.stride());
        return diff == REJECTED ? OptionalDouble.empty() : OptionalDouble.of(similarity(diff));
    }

    @Override
    public String toString() {
        return "SimilarityMetric [tolerance=" + tolerance + ", sample=" + sampleWidth + "x" + sampleHeight + ", pixelThreshold=" + pixelThreshold
            + ", windowThreshold=" + windowThreshold + ", maxTotalDiff=" + maxTotalDiff + "]";
    }
}
