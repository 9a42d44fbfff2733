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

import javax.imageio.ImageIO;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.locateimage.util.Timer;

public class ImageFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageFile.class);

    /**
     * <p>
     * Read a {@link BufferedImage} from a file using whatever {@link ImageIO} readers are
     * registered.
     * </p>
     *
     * @throws FileNotFoundException if the file doesn't exist.
     * @throws UnsupportedFormatException if none of the registered readers can decode the file.
     * @throws IOException if the file can't be read.
     */
    public static BufferedImage readBufferedImageFromFile(final String filename) throws IOException {
        final File file = new File(filename);
        if(!file.exists())
            throw new FileNotFoundException("Couldn't find file \"" + filename + "\"");

        final Timer timer = Timer.started();
        final BufferedImage ret = ImageIO.read(file);
        if(ret == null)
            throw new UnsupportedFormatException("None of the installed image readers can decode \"" + filename + "\"");

        LOGGER.debug("Read {}x{} image from {} in {} seconds", ret.getWidth(), ret.getHeight(), filename, timer.stop());
        return ret;
    }

    /**
     * Read an image file and convert it to a canonical {@link PixelBuffer}. This is the
     * same as {@code ImageConversion.toPixelBuffer(readBufferedImageFromFile(filename))}.
     *
     * @throws FileNotFoundException if the file doesn't exist.
     * @throws UnsupportedFormatException if none of the registered readers can decode the file.
     * @throws IOException if the file can't be read.
     */
    public static PixelBuffer readPixelBuffer(final String filename) throws IOException {
        return ImageConversion.toPixelBuffer(readBufferedImageFromFile(filename));
    }

    /**
     * Write the {@link PixelBuffer} to a file. The format is chosen from the file's extension. The
     * writers want straight (not premultiplied) alpha so the pixels are redrawn first. Formats that
     * can't carry alpha (jpeg, bmp) get the pixels composited onto black.
     *
     * @throws UnsupportedFormatException if there's no writer for the extension.
     * @throws IOException if the file can't be written.
     */
    public static void writePixelBuffer(final PixelBuffer buffer, final String filename) throws IOException {
        final String ext = StringUtils.substringAfterLast(filename, ".").toLowerCase(Locale.ROOT);
        if(ext.length() == 0)
            throw new UnsupportedFormatException("Can't determine the image format for \"" + filename + "\" since it has no extension");

        final boolean keepAlpha = "png".equals(ext) || "gif".equals(ext) || "tif".equals(ext) || "tiff".equals(ext);
        final BufferedImage image = redraw(ImageConversion.toBufferedImage(buffer), keepAlpha ? BufferedImage.TYPE_4BYTE_ABGR : BufferedImage.TYPE_3BYTE_BGR);

        if(!ImageIO.write(image, ext, new File(filename)))
            throw new UnsupportedFormatException("There's no image writer installed for \"" + ext + "\" files");

        LOGGER.debug("Wrote {}x{} image to {}", buffer.width(), buffer.height(), filename);
    }

    private static BufferedImage redraw(final BufferedImage image, final int type) {
        final BufferedImage ret = new BufferedImage(image.getWidth(), image.getHeight(), type);
        final Graphics2D g = ret.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return ret;
    }
}
