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

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.locateimage.image.PixelBuffer;
import ai.kognition.locateimage.util.Timer;

/**
 * <p>
 * Finds a sample image inside a canvas image. Every search is a single {@link WindowScanner} pass
 * whose matches are either collected ({@link #findAll}), reduced to one ({@link #findOne}) or
 * handed to the caller ({@link #forEach}).
 * </p>
 *
 * <p>
 * A {@code Locator} holds no per search state and can be shared between threads. The buffers
 * must not be modified while a search over them is running.
 * </p>
 */
public class Locator {
    private static final Logger LOGGER = LoggerFactory.getLogger(Locator.class);

    private final LocateConfig config;
    private final WindowScanner scanner;

    /**
     * A locator using {@link LocateConfig#defaults()}.
     */
    public Locator() {
        this(LocateConfig.defaults());
    }

    public Locator(final LocateConfig config) {
        if(config == null)
            throw new IllegalArgumentException("A LocateConfig is required");
        this.config = config;
        this.scanner = new WindowScanner(config.getParallelism());
    }

    public LocateConfig getConfig() {
        return config;
    }

    /**
     * Every match at the configured tolerance.
     *
     * @see #findAll(PixelBuffer, PixelBuffer, double, Cancellation)
     */
    public List<Match> findAll(final PixelBuffer canvas, final PixelBuffer sample) {
        return findAll(canvas, sample, config.getTolerance(), Cancellation.NONE);
    }

    public List<Match> findAll(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance) {
        return findAll(canvas, sample, tolerance, Cancellation.NONE);
    }

    /**
     * Every window of the canvas that matches the sample within the tolerance, sorted best first
     * with ties in row major order (see {@link MatchOrder}). The list is empty if there are none.
     *
     * @throws LocateCancelledException if the search was cancelled. The matches found up to that
     *     point, sorted, are in {@link LocateCancelledException#getPartialMatches()}.
     * @throws IllegalArgumentException if the tolerance isn't in {@code [0, 1]}.
     */
    public List<Match> findAll(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance, final Cancellation cancel) {
        return run(MatchAccumulator.all(), canvas, sample, tolerance, cancel, "findAll");
    }

    /**
     * One match using the configured tolerance and selection.
     *
     * @see #findOne(PixelBuffer, PixelBuffer, double, Selection, Cancellation)
     */
    public Match findOne(final PixelBuffer canvas, final PixelBuffer sample) {
        return findOne(canvas, sample, config.getTolerance(), config.getSelection(), Cancellation.NONE);
    }

    public Match findOne(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance, final Selection selection) {
        return findOne(canvas, sample, tolerance, selection, Cancellation.NONE);
    }

    /**
     * <p>
     * A single match chosen by the {@link Selection}:
     * </p>
     *
     * <ul>
     * <li>{@link Selection#FIRST_ENCOUNTERED} the first match in row major order. The scan stops there.</li>
     * <li>{@link Selection#BEST_OVERALL} the highest similarity, the earliest in row major order on a tie.</li>
     * <li>{@link Selection#BEST_OVERALL_UNIQUE} the same, but only if it's the only match.</li>
     * </ul>
     *
     * @throws MatchNotFoundException if nothing matched.
     * @throws MultipleMatchesException in {@link Selection#BEST_OVERALL_UNIQUE} mode if more than one
     *     window matched. It carries the best of them.
     * @throws LocateCancelledException if the search was cancelled. It carries the best match seen
     *     so far, if any.
     * @throws IllegalArgumentException if the tolerance isn't in {@code [0, 1]}.
     */
    public Match findOne(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance, final Selection selection,
        final Cancellation cancel) {
        if(selection == null)
            throw new IllegalArgumentException("A selection is required");
        final String description = "a " + checked(sample, "sample").width() + "x" + sample.height() + " sample at tolerance " + tolerance;
        return run(MatchAccumulator.forSelection(selection, description), canvas, sample, tolerance, cancel, "findOne(" + selection + ")");
    }

    public ScanStatus forEach(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance, final MatchVisitor visitor) {
        return forEach(canvas, sample, tolerance, Cancellation.NONE, visitor);
    }

    /**
     * Hand every match, in row major order, to the visitor. A {@link VisitResult#STOP} ends the
     * search normally.
     *
     * @return {@link ScanStatus#STOPPED} if the visitor stopped the search.
     *
     * @throws CallbackFailedException if the visitor threw or returned {@link VisitResult#fail(Throwable)}.
     * @throws LocateCancelledException if the search was cancelled.
     * @throws IllegalArgumentException if the tolerance isn't in {@code [0, 1]}.
     */
    public ScanStatus forEach(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance, final Cancellation cancel,
        final MatchVisitor visitor) {
        if(visitor == null)
            throw new IllegalArgumentException("A MatchVisitor is required");
        final Timer timer = Timer.started();
        final ScanStatus ret = scanner.scan(checked(canvas, "canvas"), checked(sample, "sample"), tolerance, effective(cancel), visitor);
        LOGGER.debug("forEach of a {}x{} sample over a {}x{} canvas was {} in {} seconds", sample.width(), sample.height(), canvas.width(),
            canvas.height(), ret, timer.stop());
        return ret;
    }

    private <R> R run(final MatchAccumulator<R> acc, final PixelBuffer canvas, final PixelBuffer sample, final double tolerance,
        final Cancellation cancel, final String operation) {
        checked(canvas, "canvas");
        checked(sample, "sample");

        final Timer timer = Timer.started();
        final ScanStatus status;
        try {
            status = scanner.scan(canvas, sample, tolerance, effective(cancel), acc);
        } catch(final LocateCancelledException lce) {
            LOGGER.debug("{} cancelled ({}) after {} matches in {} seconds", operation, lce.getCancellationCause(), acc.count(), timer.stop());
            throw acc.cancelled(lce);
        }

        LOGGER.debug("{} of a {}x{} sample over a {}x{} canvas at tolerance {} saw {} matches in {} seconds", operation, sample.width(),
            sample.height(), canvas.width(), canvas.height(), tolerance, acc.count(), timer.stop());
        return acc.result(status);
    }

    private Cancellation effective(final Cancellation cancel) {
        final Cancellation ret = cancel == null ? Cancellation.NONE : cancel;
        final Duration timeout = config.getTimeout();
        return timeout == null ? ret : ret.or(Cancellation.withTimeout(timeout));
    }

    private static PixelBuffer checked(final PixelBuffer buffer, final String what) {
        if(buffer == null)
            throw new IllegalArgumentException("The " + what + " can't be null");
        return buffer;
    }
}
