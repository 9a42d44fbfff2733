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

import java.awt.image.BufferedImage;
import java.util.List;

import ai.kognition.locateimage.image.ImageConversion;
import ai.kognition.locateimage.image.PixelBuffer;

/**
 * Static entry points using a sequential {@link Locator} with no timeout. Use a {@link Locator}
 * built from a {@link LocateConfig} for anything else.
 */
public class LocateImage {
    private static final Locator locator = new Locator(LocateConfig.builtIn());

    public static List<Match> findAll(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance) {
        return locator.findAll(canvas, sample, tolerance);
    }

    public static List<Match> findAll(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance, final Cancellation cancel) {
        return locator.findAll(canvas, sample, tolerance, cancel);
    }

    public static Match findOne(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance, final Selection selection) {
        return locator.findOne(canvas, sample, tolerance, selection);
    }

    public static Match findOne(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance, final Selection selection,
        final Cancellation cancel) {
        return locator.findOne(canvas, sample, tolerance, selection, cancel);
    }

    public static ScanStatus forEach(final PixelBuffer canvas, final PixelBuffer sample, final double tolerance, final Cancellation cancel,
        final MatchVisitor visitor) {
        return locator.forEach(canvas, sample, tolerance, cancel, visitor);
    }

    /**
     * Convert both images and find every match.
     */
    public static List<Match> findAll(final BufferedImage canvas, final BufferedImage sample, final double tolerance) {
        return locator.findAll(ImageConversion.toPixelBuffer(canvas), ImageConversion.toPixelBuffer(sample), tolerance);
    }
}
