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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ai.kognition.locateimage.image.geometry.Region;

public class MatchTest {

    @Test
    public void testToString() {
        assertEquals("(10,20)+(5x6) 99.3464%", new Match(new Region(10, 20, 5, 6), 0.99346405).toString());
        assertEquals("(0,0)+(1x1) 100.0000%", new Match(new Region(0, 0, 1, 1), 1.0).toString());
    }

    @Test
    public void testEquality() {
        final Match a = new Match(new Region(1, 2, 3, 4), 0.5);
        assertEquals(a, new Match(new Region(1, 2, 3, 4), 0.5));
        assertEquals(a.hashCode(), new Match(new Region(1, 2, 3, 4), 0.5).hashCode());
        assertNotEquals(a, new Match(new Region(1, 2, 3, 4), 0.6));
        assertNotEquals(a, new Match(new Region(2, 2, 3, 4), 0.5));
    }

    @Test
    public void testBefore() {
        final Match high = new Match(new Region(50, 50, 1, 1), 0.9);
        final Match low = new Match(new Region(0, 0, 1, 1), 0.8);
        assertTrue(high.before(low));
        assertFalse(low.before(high));

        // within the precision the position decides
        final Match upper = new Match(new Region(9, 3, 1, 1), 0.7000001);
        final Match lower = new Match(new Region(0, 4, 1, 1), 0.7);
        assertTrue(upper.before(lower));
        assertFalse(lower.before(upper));
        assertFalse(upper.before(upper));

        final Match left = new Match(new Region(2, 4, 1, 1), 0.7);
        final Match right = new Match(new Region(3, 4, 1, 1), 0.7000005);
        assertTrue(left.before(right));
    }

    @Test
    public void testRegionRequired() {
        assertThrows(IllegalArgumentException.class, () -> new Match(null, 1.0));
    }
}
