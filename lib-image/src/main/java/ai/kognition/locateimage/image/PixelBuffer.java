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

package ai.kognition.locateimage.image;

import java.awt.Color;

import ai.kognition.locateimage.image.geometry.Region;

/**
 * <p>
 * {@link PixelBuffer} is the canonical raw pixel storage the search works on. Every pixel
 * is {@value #BYTES_PER_PIXEL} bytes in the order R, G, B, A with the color channels
 * premultiplied by alpha. Rows are {@link #stride()} bytes apart in the backing array, which
 * may be more than {@code 4 * width} when the buffer is a view onto part of a larger one.
 * </p>
 *
 * <p>
 * The buffer has an origin ({@link #minX()}, {@link #minY()}) so that a view created with
 * {@link #subBuffer(Region)} keeps the coordinates of the buffer it was taken from. All of the
 * coordinate based accessors take coordinates in that space, i.e. within {@link #bounds()}.
 * </p>
 *
 * <p>
 * A {@link PixelBuffer} doesn't copy or lock its backing array. Anything that reads from it
 * assumes nobody is writing to it at the same time.
 * </p>
 *
 * <p>
 * You get one by converting an image with {@link ImageConversion#toPixelBuffer(java.awt.image.BufferedImage)},
 * by reading a file with {@link ImageFile#readPixelBuffer(String)}, or directly:
 * </p>
 *
 * <pre>
 * <code>
 * final PixelBuffer canvas = PixelBuffer.allocate(100, 100);
 * canvas.fill(canvas.bounds(), Color.WHITE);
 * canvas.fill(new Region(10, 10, 10, 10), Color.RED);
 * </code>
 * </pre>
 */
public final class PixelBuffer {
    public static final int BYTES_PER_PIXEL = 4;

    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;
    public static final int ALPHA = 3;

    private final byte[] pix;
    private final int offset;
    private final int stride;
    private final int width;
    private final int height;
    private final int minX;
    private final int minY;

    private PixelBuffer(final byte[] pix, final int offset, final int width, final int height, final int stride, final int minX, final int minY) {
        this.pix = pix;
        this.offset = offset;
        this.width = width;
        this.height = height;
        this.stride = stride;
        this.minX = minX;
        this.minY = minY;
    }

    /**
     * A new, fully transparent, buffer with its origin at (0, 0) and no padding between rows.
     */
    public static PixelBuffer allocate(final int width, final int height) {
        if(width < 0 || height < 0)
            throw new UnsupportedFormatException("Can't allocate a " + width + " x " + height + " pixel buffer");
        return new PixelBuffer(new byte[Math.multiplyExact(Math.multiplyExact(width, height), BYTES_PER_PIXEL)], 0, width, height, width * BYTES_PER_PIXEL, 0, 0);
    }

    /**
     * Wrap existing RGBA bytes without copying them.
     *
     * @throws UnsupportedFormatException if the array can't hold a {@code width x height} image
     * with the given stride.
     */
    public static PixelBuffer wrap(final byte[] pix, final int width, final int height, final int stride) {
        return wrap(pix, 0, width, height, stride, 0, 0);
    }

    /**
     * Wrap existing RGBA bytes starting at {@code offset} without copying them. The top left pixel
     * will have the coordinates ({@code minX}, {@code minY}).
     *
     * @throws UnsupportedFormatException if the array can't hold a {@code width x height} image
     * with the given stride from the given offset.
     */
    public static PixelBuffer wrap(final byte[] pix, final int offset, final int width, final int height, final int stride, final int minX,
        final int minY) {
        if(pix == null)
            throw new UnsupportedFormatException("Can't wrap a null pixel array");
        if(width < 0 || height < 0)
            throw new UnsupportedFormatException("Invalid pixel buffer dimensions " + width + " x " + height);
        if(offset < 0)
            throw new UnsupportedFormatException("Invalid pixel buffer offset " + offset);
        if(stride < (long)width * BYTES_PER_PIXEL)
            throw new UnsupportedFormatException("A row stride of " + stride + " bytes can't hold " + width + " pixels of " + BYTES_PER_PIXEL + " bytes each");
        if(width > 0 && height > 0) {
            final long required = offset + ((long)(height - 1) * stride) + ((long)width * BYTES_PER_PIXEL);
            if(required > pix.length)
                throw new UnsupportedFormatException(
                    "A " + width + " x " + height + " image with a stride of " + stride + " needs " + required + " bytes but only " + pix.length
                        + " were supplied");
        }
        return new PixelBuffer(pix, offset, width, height, stride, minX, minY);
    }

    /**
     * A view onto part of this buffer sharing the same backing array. The view keeps this
     * buffer's coordinates so {@code sub.bounds()} equals {@code region}.
     *
     * @throws IllegalArgumentException if the region isn't entirely within {@link #bounds()}.
     */
    public PixelBuffer subBuffer(final Region region) {
        if(!bounds().contains(region))
            throw new IllegalArgumentException("The region " + region + " isn't within the buffer bounds " + bounds());
        if(region.isEmpty())
            return new PixelBuffer(pix, offset, region.getWidth(), region.getHeight(), stride, region.getX(), region.getY());
        return new PixelBuffer(pix, indexOf(region.getX(), region.getY()), region.getWidth(), region.getHeight(), stride, region.getX(),
            region.getY());
    }

    /**
     * A tightly packed copy of this buffer with the same bounds.
     */
    public PixelBuffer copy() {
        final int rowBytes = width * BYTES_PER_PIXEL;
        final byte[] dst = new byte[rowBytes * height];
        for(int row = 0; row < height; row++)
            System.arraycopy(pix, offset + row * stride, dst, row * rowBytes, rowBytes);
        return new PixelBuffer(dst, 0, width, height, rowBytes, minX, minY);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * The number of bytes between the start of one row and the start of the next.
     */
    public int stride() {
        return stride;
    }

    /**
     * The index in {@link #data()} of the top left pixel's red channel.
     */
    public int offset() {
        return offset;
    }

    public int minX() {
        return minX;
    }

    public int minY() {
        return minY;
    }

    public Region bounds() {
        return new Region(minX, minY, width, height);
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * Direct access to the backing array. It's shared, not copied.
     */
    public byte[] data() {
        return pix;
    }

    /**
     * The index in {@link #data()} of the red channel of the pixel at ({@code x}, {@code y}).
     */
    public int indexOf(final int x, final int y) {
        if(!bounds().contains(x, y))
            throw new IndexOutOfBoundsException("(" + x + "," + y + ") is outside of " + bounds());
        return offset + ((y - minY) * stride) + ((x - minX) * BYTES_PER_PIXEL);
    }

    /**
     * The pixel at ({@code x}, {@code y}) packed as {@code 0xRRGGBBAA}.
     */
    public int getRGBA(final int x, final int y) {
        final int i = indexOf(x, y);
        return ((pix[i + RED] & 0xff) << 24) | ((pix[i + GREEN] & 0xff) << 16) | ((pix[i + BLUE] & 0xff) << 8) | (pix[i + ALPHA] & 0xff);
    }

    /**
     * Set the pixel at ({@code x}, {@code y}). The color channels are stored as given so they
     * should already be premultiplied by {@code a}.
     */
    public void setRGBA(final int x, final int y, final int r, final int g, final int b, final int a) {
        final int i = indexOf(x, y);
        pix[i + RED] = (byte)r;
        pix[i + GREEN] = (byte)g;
        pix[i + BLUE] = (byte)b;
        pix[i + ALPHA] = (byte)a;
    }

    /**
     * Paint every pixel of {@code region} that falls within this buffer with {@code color}. The
     * color is premultiplied by its alpha before it's stored.
     */
    public void fill(final Region region, final Color color) {
        final Region clipped = bounds().intersect(region);
        if(clipped.isEmpty())
            return;

        final int a = color.getAlpha();
        final byte r = (byte)premultiply(color.getRed(), a);
        final byte g = (byte)premultiply(color.getGreen(), a);
        final byte b = (byte)premultiply(color.getBlue(), a);

        for(int y = clipped.getY(); y < clipped.maxY(); y++) {
            int i = indexOf(clipped.getX(), y);
            for(int x = clipped.getX(); x < clipped.maxX(); x++) {
                pix[i + RED] = r;
                pix[i + GREEN] = g;
                pix[i + BLUE] = b;
                pix[i + ALPHA] = (byte)a;
                i += BYTES_PER_PIXEL;
            }
        }
    }

    /**
     * Scale an 8 bit color channel by an 8 bit alpha, rounding to the nearest value.
     */
    public static int premultiply(final int channel, final int alpha) {
        if(alpha == 0xff)
            return channel;
        return ((channel * alpha) + 127) / 255;
    }

    @Override
    public String toString() {
        return "PixelBuffer [bounds=" + bounds() + ", stride=" + stride + "]";
    }
}
