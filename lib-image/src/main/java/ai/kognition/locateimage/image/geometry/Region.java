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

package ai.kognition.locateimage.image.geometry;

/**
 * An immutable axis aligned rectangle in pixel coordinates. The rectangle covers the
 * columns {@code [x, x + width)} and the rows {@code [y, y + height)}.
 */
public final class Region {
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public Region(final int x, final int y, final int width, final int height) {
        if(width < 0 || height < 0)
            throw new IllegalArgumentException("A Region can't have a negative size. Given " + width + " x " + height);
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * Construct the region from its corners. {@code maxX} and {@code maxY} are exclusive.
     */
    public static Region fromCorners(final int minX, final int minY, final int maxX, final int maxY) {
        return new Region(minX, minY, maxX - minX, maxY - minY);
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Exclusive right edge.
     */
    public int maxX() {
        return x + width;
    }

    /**
     * Exclusive bottom edge.
     */
    public int maxY() {
        return y + height;
    }

    public long area() {
        return (long)width * (long)height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public boolean contains(final Region other) {
        return other.x >= x && other.y >= y && other.maxX() <= maxX() && other.maxY() <= maxY();
    }

    public boolean contains(final int px, final int py) {
        return px >= x && py >= y && px < maxX() && py < maxY();
    }

    /**
     * The overlap of the two regions. If they don't overlap the result is empty.
     */
    public Region intersect(final Region other) {
        final int minX = Math.max(x, other.x);
        final int minY = Math.max(y, other.y);
        final int mX = Math.min(maxX(), other.maxX());
        final int mY = Math.min(maxY(), other.maxY());
        if(mX <= minX || mY <= minY)
            return new Region(minX, minY, 0, 0);
        return fromCorners(minX, minY, mX, mY);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")-(" + maxX() + "," + maxY() + ")";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + x;
        result = prime * result + y;
        result = prime * result + width;
        result = prime * result + height;
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj) return true;
        if(obj == null) return false;
        if(getClass() != obj.getClass()) return false;
        final Region other = (Region)obj;
        return x == other.x && y == other.y && width == other.width && height == other.height;
    }
}
