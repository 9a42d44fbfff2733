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

import static ai.kognition.locateimage.image.PixelBuffer.BYTES_PER_PIXEL;
import static ai.kognition.locateimage.locate.SimilarityMetric.REJECTED;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.locateimage.image.PixelBuffer;
import ai.kognition.locateimage.image.geometry.Region;

/**
 * <p>
 * Brute force sliding window search of a canvas for a sample. Every position the sample fits at
 * is compared using a {@link SimilarityMetric} and every window that isn't rejected is handed to
 * a {@link MatchVisitor} as a {@link Match}.
 * </p>
 *
 * <p>
 * Positions are visited in row major order: the top of the window moves down one row at a time
 * and, within a row, the left edge moves right one column at a time. The {@link Cancellation} is
 * polled at the start of each row.
 * </p>
 *
 * <p>
 * With a parallelism greater than one the rows are split into contiguous bands that are scanned
 * on separate threads. The matches of each band are held until every band before it has been
 * delivered so the visitor still sees them in row major order, on the calling thread, and the
 * outcome of {@link VisitResult#STOP}, failures and cancellation are the same as for a
 * single threaded scan.
 * </p>
 */
public class WindowScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(WindowScanner.class);

    private static final AtomicInteger threadCount = new AtomicInteger(0);

    private final int parallelism;

    public WindowScanner() {
        this(1);
    }

    public WindowScanner(final int parallelism) {
        if(parallelism < 1)
            throw new IllegalArgumentException("The parallelism must be at least 1 but was " + parallelism);
        this.parallelism = parallelism;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Scan the canvas for the sample. A sample that's empty, or larger than the canvas in either
     * dimension, gives an immediately completed scan with no matches.
     *
     * @return {@link ScanStatus#STOPPED} if the visitor asked to stop, otherwise {@link ScanStatus#COMPLETED}.
     *
     * @throws IllegalArgumentException if the tolerance isn't in {@code [0, 1]}.
     * @throws LocateCancelledException if the cancellation was active at the start of a row.
     * @throws CallbackFailedException if the visitor failed.
     */
    public ScanStatus scan(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance, final Cancellation cancellation,
        final MatchVisitor visitor) {
        final SimilarityMetric metric = new SimilarityMetric(tolerance, sample.width(), sample.height());

        if(sample.isEmpty() || canvas.isEmpty() || sample.width() > canvas.width() || sample.height() > canvas.height()) {
            LOGGER.debug("Nothing to scan for a {}x{} sample in a {}x{} canvas", sample.width(), sample.height(), canvas.width(), canvas.height());
            return ScanStatus.COMPLETED;
        }

        final Cancellation cancel = cancellation == null ? Cancellation.NONE : cancellation;
        final int rows = canvas.height() - sample.height() + 1;

        LOGGER.trace("Scanning {} rows with {}", rows, metric);

        if(parallelism == 1 || rows == 1)
            return scanSequential(canvas, sample, metric, rows, cancel, visitor);
        return scanPartitioned(canvas, sample, metric, rows, cancel, visitor);
    }

    private static ScanStatus scanSequential(final PixelBuffer canvas, final PixelBuffer sample, final SimilarityMetric metric, final int rows,
        final Cancellation cancel, final MatchVisitor visitor) {
        for(int y = 0; y < rows; y++) {
            if(cancel.isCancelled())
                throw new LocateCancelledException(causeOf(cancel));

            if(scanRow(canvas, sample, metric, y, m -> deliver(visitor, m)))
                return ScanStatus.STOPPED;
        }
        return ScanStatus.COMPLETED;
    }

    private ScanStatus scanPartitioned(final PixelBuffer canvas, final PixelBuffer sample, final SimilarityMetric metric, final int rows,
        final Cancellation cancel, final MatchVisitor visitor) {
        final int numBands = Math.min(parallelism, rows);
        final AtomicBoolean abandon = new AtomicBoolean(false);

        final ExecutorService executor = Executors.newFixedThreadPool(numBands, r -> {
            final Thread ret = new Thread(r, "locate-scan-" + threadCount.getAndIncrement());
            ret.setDaemon(true);
            return ret;
        });

        try {
            final List<Future<Pair<List<Match>, String>>> bands = new ArrayList<>(numBands);
            for(int b = 0; b < numBands; b++) {
                final int from = bandStart(rows, b, numBands);
                final int to = bandStart(rows, b + 1, numBands);
                bands.add(executor.submit(() -> scanBand(canvas, sample, metric, from, to, cancel, abandon)));
            }

            for(int b = 0; b < numBands; b++) {
                final Pair<List<Match>, String> result = await(bands.get(b));
                final List<Match> matches = result.getLeft();
                final int to = bandStart(rows, b + 1, numBands);
                int next = 0;
                // replayed a row at a time, polling the cancellation before each row like a single threaded scan.
                for(int y = bandStart(rows, b, numBands); y < to; y++) {
                    if(cancel.isCancelled())
                        throw new LocateCancelledException(causeOf(cancel));
                    final int row = canvas.minY() + y;
                    for(; next < matches.size() && matches.get(next).getRegion().getY() == row; next++) {
                        if(deliver(visitor, matches.get(next)))
                            return ScanStatus.STOPPED;
                    }
                }
                // the band saw the cancellation so everything after it is moot.
                if(result.getRight() != null)
                    throw new LocateCancelledException(result.getRight());
            }
            return ScanStatus.COMPLETED;
        } finally {
            abandon.set(true);
            executor.shutdownNow();
        }
    }

    private static int bandStart(final int rows, final int band, final int numBands) {
        return (int)(((long)rows * band) / numBands);
    }

    /**
     * Scan rows {@code [from, to)} collecting the matches. The right side of the result is the
     * cancellation cause if the cancellation was seen before the band was finished.
     */
    private static Pair<List<Match>, String> scanBand(final PixelBuffer canvas, final PixelBuffer sample, final SimilarityMetric metric, final int from,
        final int to, final Cancellation cancel, final AtomicBoolean abandon) {
        final List<Match> matches = new ArrayList<>();
        for(int y = from; y < to; y++) {
            if(cancel.isCancelled())
                return Pair.of(matches, causeOf(cancel));
            if(abandon.get())
                break;
            scanRow(canvas, sample, metric, y, m -> !matches.add(m));
        }
        return Pair.of(matches, null);
    }

    /**
     * Hands each match in row {@code y} to {@code sink} until it returns true. Returns true if the
     * sink stopped the row.
     */
    private static boolean scanRow(final PixelBuffer canvas, final PixelBuffer sample, final SimilarityMetric metric, final int y,
        final Predicate<Match> sink) {
        final byte[] canvasPix = canvas.data();
        final byte[] samplePix = sample.data();
        final int canvasStride = canvas.stride();
        final int sampleStride = sample.stride();
        final int sampleIndex = sample.offset();
        final int cols = canvas.width() - sample.width() + 1;
        final int rowStart = canvas.offset() + (y * canvasStride);

        for(int x = 0; x < cols; x++) {
            final long diff = metric.windowDiff(canvasPix, rowStart + (x * BYTES_PER_PIXEL), canvasStride, samplePix, sampleIndex, sampleStride);
            if(diff != REJECTED) {
                final Match m = new Match(new Region(canvas.minX() + x, canvas.minY() + y, sample.width(), sample.height()), metric.similarity(diff));
                if(sink.test(m))
                    return true;
            }
        }
        return false;
    }

    /**
     * Returns true if the visitor asked to stop.
     */
    private static boolean deliver(final MatchVisitor visitor, final Match m) {
        final VisitResult result;
        try {
            result = visitor.visit(m);
        } catch(final RuntimeException rte) {
            throw new CallbackFailedException(m, rte);
        }

        if(result == null)
            throw new CallbackFailedException(m, new NullPointerException("The match visitor returned null"));

        switch(result.kind()) {
            case CONTINUE:
                return false;
            case STOP:
                return true;
            case FAIL:
            default:
                throw new CallbackFailedException(m, result.cause());
        }
    }

    private static String causeOf(final Cancellation cancel) {
        final String ret = cancel.cause();
        return ret == null ? Cancellation.CANCELED : ret;
    }

    private static <T> T await(final Future<T> future) {
        try {
            return future.get();
        } catch(final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new LocateCancelledException("interrupted");
        } catch(final ExecutionException ee) {
            final Throwable cause = ee.getCause();
            if(cause instanceof RuntimeException)
                throw (RuntimeException)cause;
            if(cause instanceof Error)
                throw (Error)cause;
            throw new LocateException("Scanning a band of the canvas failed", cause);
        }
    }
}
