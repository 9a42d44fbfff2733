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

import java.awt.Color;
import java.util.Random;

import ai.kognition.locateimage.image.PixelBuffer;
import ai.kognition.locateimage.image.geometry.Region;

/**
 * Canvases and samples shared by the tests.
 */
class LocateFixtures {
    static final Color RED1 = new Color(255, 0, 0);
    static final Color RED2 = new Color(250, 0, 0);
    static final Color RED3 = new Color(255, 5, 5);

    static final Region R1 = new Region(5, 5, 10, 10);
    static final Region R2 = new Region(10, 10, 10, 10);
    static final Region R3 = new Region(50, 5, 10, 10);
    static final Region R4 = new Region(90, 90, 10, 10);

    /**
     * 100x100 white with four 10x10 blocks. R2 is painted over the bottom right corner of R1
     * so only 75 pixels of R1 keep {@link #RED3}.
     */
    static PixelBuffer fourBlockCanvas() {
        final PixelBuffer ret = solid(100, 100, Color.WHITE);
        ret.fill(R1, RED3);
        ret.fill(R2, RED1);
        ret.fill(R3, RED2);
        ret.fill(R4, RED2);
        return ret;
    }

    static PixelBuffer solid(final int width, final int height, final Color color) {
        final PixelBuffer ret = PixelBuffer.allocate(width, height);
        ret.fill(ret.bounds(), color);
        return ret;
    }

    /**
     * Opaque pixels with each channel drawn from {@code [0, levels)} scaled to the full byte range.
     * Few levels give lots of near and exact repeats.
     */
    static PixelBuffer noise(final long seed, final int width, final int height, final int levels) {
        final Random random = new Random(seed);
        final int step = 255 / (levels - 1);
        final PixelBuffer ret = PixelBuffer.allocate(width, height);
        for(int y = 0; y < height; y++) {
            for(int x = 0; x < width; x++)
                ret.setRGBA(x, y, random.nextInt(levels) * step, random.nextInt(levels) * step, random.nextInt(levels) * step, 255);
        }
        return ret;
    }
}
