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

import static ai.kognition.locateimage.image.PixelBuffer.ALPHA;
import static ai.kognition.locateimage.image.PixelBuffer.BLUE;
import static ai.kognition.locateimage.image.PixelBuffer.BYTES_PER_PIXEL;
import static ai.kognition.locateimage.image.PixelBuffer.GREEN;
import static ai.kognition.locateimage.image.PixelBuffer.RED;
import static ai.kognition.locateimage.image.PixelBuffer.premultiply;

import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.ComponentSampleModel;
import java.awt.image.DataBuffer;
import java.awt.image.DataBufferByte;
import java.awt.image.Raster;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion between {@link BufferedImage}s and the canonical {@link PixelBuffer} layout.
 */
public class ImageConversion {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageConversion.class);

    /**
     * <p>
     * Convert any {@link BufferedImage} into a new canonical {@link PixelBuffer} with its origin at (0, 0).
     * </p>
     *
     * <p>
     * Images backed by 8 bit interleaved sRGB bytes (for example {@link BufferedImage#TYPE_4BYTE_ABGR},
     * {@link BufferedImage#TYPE_4BYTE_ABGR_PRE} and {@link BufferedImage#TYPE_3BYTE_BGR}) are copied
     * channel by channel. Everything else goes through {@link BufferedImage#getRGB(int, int, int, int, int[], int, int)}
     * and so through the image's {@link ColorModel}.
     * </p>
     */
    public static PixelBuffer toPixelBuffer(final BufferedImage image) {
        if(image == null)
            throw new IllegalArgumentException("Can't convert a null image");

        final PixelBuffer ret = PixelBuffer.allocate(image.getWidth(), image.getHeight());
        if(ret.isEmpty())
            return ret;

        final ColorModel cm = image.getColorModel();
        final Raster raster = image.getRaster();
        if(isInterleavedSrgbBytes(cm, raster)) {
            LOGGER.trace("Copying the interleaved bytes of a {} image", image.getType());
            copyInterleaved(image, (ComponentSampleModel)raster.getSampleModel(), ret);
        } else {
            LOGGER.trace("Converting a {} image with a {} through its color model", image.getType(), cm.getClass().getSimpleName());
            copyThroughColorModel(image, ret);
        }
        return ret;
    }

    /**
     * Copy a {@link PixelBuffer} into a new {@link BufferedImage#TYPE_4BYTE_ABGR_PRE} image. The
     * result is exact in that converting it back with {@link #toPixelBuffer(BufferedImage)} gives
     * the same bytes.
     */
    public static BufferedImage toBufferedImage(final PixelBuffer buffer) {
        if(buffer.isEmpty())
            throw new UnsupportedFormatException("A BufferedImage can't be " + buffer.width() + " x " + buffer.height());

        final BufferedImage ret = new BufferedImage(buffer.width(), buffer.height(), BufferedImage.TYPE_4BYTE_ABGR_PRE);
        final byte[] dst = ((DataBufferByte)ret.getRaster().getDataBuffer()).getData();
        final byte[] src = buffer.data();
        int d = 0;
        for(int row = 0; row < buffer.height(); row++) {
            int s = buffer.offset() + (row * buffer.stride());
            for(int col = 0; col < buffer.width(); col++) {
                dst[d++] = src[s + ALPHA];
                dst[d++] = src[s + BLUE];
                dst[d++] = src[s + GREEN];
                dst[d++] = src[s + RED];
                s += BYTES_PER_PIXEL;
            }
        }
        return ret;
    }

    private static boolean isInterleavedSrgbBytes(final ColorModel cm, final Raster raster) {
        if(!(cm instanceof ComponentColorModel) || !cm.getColorSpace().isCS_sRGB())
            return false;
        if(raster.getDataBuffer().getDataType() != DataBuffer.TYPE_BYTE || !(raster.getSampleModel() instanceof ComponentSampleModel))
            return false;

        final int numComponents = cm.getNumComponents();
        if(numComponents != 3 && !(numComponents == 4 && cm.hasAlpha()))
            return false;
        for(int i = 0; i < numComponents; i++) {
            if(cm.getComponentSize(i) != 8)
                return false;
        }

        final ComponentSampleModel sm = (ComponentSampleModel)raster.getSampleModel();
        return sm.getNumBands() == numComponents && Arrays.stream(sm.getBankIndices()).allMatch(b -> b == 0);
    }

    private static void copyInterleaved(final BufferedImage image, final ComponentSampleModel sm, final PixelBuffer dst) {
        final Raster raster = image.getRaster();
        final byte[] src = ((DataBufferByte)raster.getDataBuffer()).getData(0);
        final int bankOffset = raster.getDataBuffer().getOffset();
        final int[] bandOffsets = sm.getBandOffsets();
        final int pixelStride = sm.getPixelStride();
        final int scanlineStride = sm.getScanlineStride();
        final boolean hasAlpha = bandOffsets.length == 4;
        final boolean needsPremultiply = hasAlpha && !image.getColorModel().isAlphaPremultiplied();
        final int tx = raster.getSampleModelTranslateX();
        final int ty = raster.getSampleModelTranslateY();

        final byte[] pix = dst.data();
        int d = 0;
        for(int y = 0; y < image.getHeight(); y++) {
            int s = bankOffset + ((y - ty) * scanlineStride) - (tx * pixelStride);
            for(int x = 0; x < image.getWidth(); x++) {
                final int a = hasAlpha ? src[s + bandOffsets[3]] & 0xff : 0xff;
                final int r = src[s + bandOffsets[0]] & 0xff;
                final int g = src[s + bandOffsets[1]] & 0xff;
                final int b = src[s + bandOffsets[2]] & 0xff;
                if(needsPremultiply) {
                    pix[d + RED] = (byte)premultiply(r, a);
                    pix[d + GREEN] = (byte)premultiply(g, a);
                    pix[d + BLUE] = (byte)premultiply(b, a);
                } else {
                    pix[d + RED] = (byte)r;
                    pix[d + GREEN] = (byte)g;
                    pix[d + BLUE] = (byte)b;
                }
                pix[d + ALPHA] = (byte)a;
                d += BYTES_PER_PIXEL;
                s += pixelStride;
            }
        }
    }

    private static void copyThroughColorModel(final BufferedImage image, final PixelBuffer dst) {
        final int width = image.getWidth();
        final int[] argbRow = new int[width];
        final byte[] pix = dst.data();
        int d = 0;
        for(int y = 0; y < image.getHeight(); y++) {
            // getRGB always hands back non-premultiplied sRGB
            image.getRGB(0, y, width, 1, argbRow, 0, width);
            for(int x = 0; x < width; x++) {
                final int argb = argbRow[x];
                final int a = (argb >>> 24) & 0xff;
                pix[d + RED] = (byte)premultiply((argb >>> 16) & 0xff, a);
                pix[d + GREEN] = (byte)premultiply((argb >>> 8) & 0xff, a);
                pix[d + BLUE] = (byte)premultiply(argb & 0xff, a);
                pix[d + ALPHA] = (byte)a;
                d += BYTES_PER_PIXEL;
            }
        }
    }
}
