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

import static ai.kognition.locateimage.locate.LocateFixtures.noise;
import static ai.kognition.locateimage.locate.LocateFixtures.solid;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.mutable.MutableInt;
import org.junit.Test;

import ai.kognition.locateimage.image.PixelBuffer;
import ai.kognition.locateimage.image.geometry.Region;

public class WindowScannerTest {
    private final WindowScanner sequential = new WindowScanner();

    private static List<Match> collect(final WindowScanner scanner, final PixelBuffer canvas, final PixelBuffer sample, final double tolerance) {
        final List<Match> ret = new ArrayList<>();
        assertEquals(ScanStatus.COMPLETED, scanner.scan(canvas, sample, tolerance, Cancellation.NONE, MatchVisitor.each(ret::add)));
        return ret;
    }

    @Test
    public void testRowMajorOrder() {
        final List<Match> matches = collect(sequential, solid(4, 3, Color.WHITE), solid(2, 2, Color.WHITE), 0.0);
        assertEquals(6, matches.size());
        int i = 0;
        for(int y = 0; y < 2; y++) {
            for(int x = 0; x < 3; x++) {
                assertEquals(new Region(x, y, 2, 2), matches.get(i).getRegion());
                assertEquals(1.0, matches.get(i).getSimilarity(), 0.0);
                i++;
            }
        }
    }

    @Test
    public void testOversizedSample() {
        final PixelBuffer canvas = solid(10, 10, Color.WHITE);
        assertTrue(collect(sequential, canvas, solid(11, 10, Color.WHITE), 1.0).isEmpty());
        assertTrue(collect(sequential, canvas, solid(10, 11, Color.WHITE), 1.0).isEmpty());
        // the same size fits exactly once
        assertEquals(1, collect(sequential, canvas, solid(10, 10, Color.WHITE), 0.0).size());
    }

    @Test
    public void testZeroSizedImages() {
        assertTrue(collect(sequential, solid(10, 10, Color.WHITE), PixelBuffer.allocate(0, 3), 0.5).isEmpty());
        assertTrue(collect(sequential, PixelBuffer.allocate(10, 0), solid(1, 1, Color.WHITE), 0.5).isEmpty());
    }

    @Test
    public void testEmptyScanIgnoresCancellation() {
        final CancellationSource cancel = new CancellationSource();
        cancel.cancel();
        assertEquals(ScanStatus.COMPLETED,
            sequential.scan(solid(5, 5, Color.WHITE), solid(6, 6, Color.WHITE), 0.0, cancel, m -> VisitResult.CONTINUE));
    }

    @Test
    public void testInvalidTolerance() {
        assertThrows(IllegalArgumentException.class,
            () -> sequential.scan(solid(5, 5, Color.WHITE), solid(1, 1, Color.WHITE), 2.0, Cancellation.NONE, m -> VisitResult.CONTINUE));
        assertThrows(IllegalArgumentException.class, () -> new WindowScanner(0));
    }

    @Test
    public void testStopEndsTheScan() {
        final MutableInt seen = new MutableInt(0);
        final ScanStatus status = sequential.scan(solid(10, 10, Color.WHITE), solid(1, 1, Color.WHITE), 0.0, Cancellation.NONE, m -> {
            seen.increment();
            return seen.intValue() == 3 ? VisitResult.STOP : VisitResult.CONTINUE;
        });
        assertEquals(ScanStatus.STOPPED, status);
        assertEquals(3, seen.intValue());
    }

    @Test
    public void testFailedVisit() {
        final IllegalStateException failure = new IllegalStateException("no thanks");
        final CallbackFailedException cfe = assertThrows(CallbackFailedException.class,
            () -> sequential.scan(solid(10, 10, Color.WHITE), solid(1, 1, Color.WHITE), 0.0, Cancellation.NONE, m -> VisitResult.fail(failure)));
        assertSame(failure, cfe.getCause());
        assertEquals(new Region(0, 0, 1, 1), cfe.getMatch().getRegion());
    }

    @Test
    public void testThrowingVisitor() {
        final CallbackFailedException cfe = assertThrows(CallbackFailedException.class,
            () -> sequential.scan(solid(10, 10, Color.WHITE), solid(1, 1, Color.WHITE), 0.0, Cancellation.NONE, m -> {
                if(m.getRegion().getY() == 2)
                    throw new UnsupportedOperationException("row 2");
                return VisitResult.CONTINUE;
            }));
        assertTrue(cfe.getCause() instanceof UnsupportedOperationException);
        assertEquals(new Region(0, 2, 1, 1), cfe.getMatch().getRegion());
    }

    @Test
    public void testNullVisitResult() {
        assertThrows(CallbackFailedException.class,
            () -> sequential.scan(solid(3, 3, Color.WHITE), solid(1, 1, Color.WHITE), 0.0, Cancellation.NONE, m -> null));
    }

    @Test
    public void testCancelledBeforeStart() {
        final CancellationSource cancel = new CancellationSource();
        cancel.cancel("enough");
        final MutableInt seen = new MutableInt(0);
        final LocateCancelledException lce = assertThrows(LocateCancelledException.class,
            () -> sequential.scan(solid(10, 10, Color.WHITE), solid(1, 1, Color.WHITE), 0.0, cancel, m -> {
                seen.increment();
                return VisitResult.CONTINUE;
            }));
        assertEquals("enough", lce.getCancellationCause());
        assertEquals(0, seen.intValue());
    }

    @Test
    public void testCancellationIsCheckedPerRow() {
        final CancellationSource cancel = new CancellationSource();
        final MutableInt seen = new MutableInt(0);
        assertThrows(LocateCancelledException.class, () -> sequential.scan(solid(20, 3, Color.WHITE), solid(1, 1, Color.WHITE), 0.0, cancel, m -> {
            seen.increment();
            cancel.cancel();
            return VisitResult.CONTINUE;
        }));
        // the rest of the first row is still scanned
        assertEquals(20, seen.intValue());
    }

    @Test
    public void testSubBufferCoordinates() {
        final PixelBuffer whole = solid(40, 40, Color.WHITE);
        whole.fill(new Region(25, 30, 3, 2), Color.GREEN);
        final PixelBuffer canvas = whole.subBuffer(new Region(20, 20, 20, 20));

        final List<Match> matches = collect(sequential, canvas, solid(3, 2, Color.GREEN), 0.0);
        assertEquals(1, matches.size());
        assertEquals(new Region(25, 30, 3, 2), matches.get(0).getRegion());
    }

    @Test
    public void testPartitionedMatchesSequential() {
        final PixelBuffer canvas = noise(99L, 60, 45, 3);
        final PixelBuffer sample = canvas.subBuffer(new Region(20, 17, 4, 3)).copy();
        final List<Match> expected = collect(sequential, canvas, sample, 0.4);
        assertTrue(expected.size() > 1);

        for(final int parallelism: new int[] {2, 3, 7, 43, 100}) {
            final WindowScanner partitioned = new WindowScanner(parallelism);
            assertEquals("parallelism " + parallelism, expected, collect(partitioned, canvas, sample, 0.4));
        }
    }

    @Test
    public void testPartitionedStop() {
        final PixelBuffer canvas = solid(30, 30, Color.WHITE);
        final List<Match> seen = new ArrayList<>();
        final ScanStatus status = new WindowScanner(4).scan(canvas, solid(2, 2, Color.WHITE), 0.0, Cancellation.NONE, m -> {
            seen.add(m);
            return seen.size() == 40 ? VisitResult.STOP : VisitResult.CONTINUE;
        });
        assertEquals(ScanStatus.STOPPED, status);
        assertEquals(40, seen.size());
        // 29 windows per row so the 40th is the 11th of the second row
        assertEquals(new Region(10, 1, 2, 2), seen.get(39).getRegion());
    }

    @Test
    public void testPartitionedFailure() {
        final RuntimeException failure = new RuntimeException("bad match");
        final CallbackFailedException cfe = assertThrows(CallbackFailedException.class,
            () -> new WindowScanner(3).scan(solid(30, 30, Color.WHITE), solid(2, 2, Color.WHITE), 0.0, Cancellation.NONE,
                m -> m.getRegion().getY() == 20 ? VisitResult.fail(failure) : VisitResult.CONTINUE));
        assertSame(failure, cfe.getCause());
        assertEquals(new Region(0, 20, 2, 2), cfe.getMatch().getRegion());
    }

    @Test
    public void testPartitionedCancellationIsCheckedPerRow() {
        for(final int parallelism: new int[] {1, 2, 4, 8}) {
            final CancellationSource cancel = new CancellationSource();
            final MutableInt seen = new MutableInt(0);
            final LocateCancelledException lce = assertThrows(LocateCancelledException.class,
                () -> new WindowScanner(parallelism).scan(solid(20, 8, Color.WHITE), solid(1, 1, Color.WHITE), 0.0, cancel, m -> {
                    seen.increment();
                    cancel.cancel();
                    return VisitResult.CONTINUE;
                }));
            assertEquals(Cancellation.CANCELED, lce.getCancellationCause());
            assertEquals("parallelism " + parallelism, 20, seen.intValue());
        }
    }

    @Test
    public void testPartitionedCancellationInTheLastBand() {
        // cancelled while visiting row 4 of 6 so row 5 is never visited
        for(final int parallelism: new int[] {1, 2, 3, 6}) {
            final CancellationSource cancel = new CancellationSource();
            final MutableInt seen = new MutableInt(0);
            assertThrows(LocateCancelledException.class,
                () -> new WindowScanner(parallelism).scan(solid(10, 6, Color.WHITE), solid(1, 1, Color.WHITE), 0.0, cancel, m -> {
                    seen.increment();
                    if(m.getRegion().getY() == 4)
                        cancel.cancel();
                    return VisitResult.CONTINUE;
                }));
            assertEquals("parallelism " + parallelism, 50, seen.intValue());
        }
    }

    @Test
    public void testPartitionedCancelledBeforeStart() {
        final CancellationSource cancel = new CancellationSource();
        cancel.cancel();
        final MutableInt seen = new MutableInt(0);
        final LocateCancelledException lce = assertThrows(LocateCancelledException.class,
            () -> new WindowScanner(4).scan(solid(30, 30, Color.WHITE), solid(2, 2, Color.WHITE), 0.0, cancel, m -> {
                seen.increment();
                return VisitResult.CONTINUE;
            }));
        assertEquals(Cancellation.CANCELED, lce.getCancellationCause());
        assertEquals(0, seen.intValue());
    }
}
