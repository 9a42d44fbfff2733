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

import static org.junit.Assert.assertEquals;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;

import org.junit.Test;

import ai.kognition.locateimage.image.geometry.Region;

public class LocateImageTest {

    private static BufferedImage image(final int width, final int height, final int type, final Color background) {
        final BufferedImage ret = new BufferedImage(width, height, type);
        final Graphics2D g = ret.createGraphics();
        try {
            g.setColor(background);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return ret;
    }

    @Test
    public void testFindAllInBufferedImages() {
        final BufferedImage canvas = image(30, 20, BufferedImage.TYPE_INT_RGB, Color.WHITE);
        final Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(Color.MAGENTA);
            g.fillRect(12, 7, 4, 3);
        } finally {
            g.dispose();
        }
        final BufferedImage sample = image(4, 3, BufferedImage.TYPE_4BYTE_ABGR, Color.MAGENTA);

        final List<Match> matches = LocateImage.findAll(canvas, sample, 0.0);
        assertEquals(1, matches.size());
        assertEquals(new Region(12, 7, 4, 3), matches.get(0).getRegion());
        assertEquals(1.0, matches.get(0).getSimilarity(), 0.0);
    }

    @Test
    public void testStaticEntryPoints() {
        final Match best = LocateImage.findOne(LocateFixtures.fourBlockCanvas(), LocateFixtures.solid(10, 10, LocateFixtures.RED1), 0.04,
            Selection.BEST_OVERALL);
        assertEquals(LocateFixtures.R2, best.getRegion());
        assertEquals(4, LocateImage.findAll(LocateFixtures.fourBlockCanvas(), LocateFixtures.solid(10, 10, LocateFixtures.RED1), 0.04).size());
    }
}
