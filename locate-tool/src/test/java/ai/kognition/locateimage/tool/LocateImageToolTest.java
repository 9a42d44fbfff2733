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


package ai.kognition.locateimage.tool;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ai.kognition.locateimage.image.ImageFile;
import ai.kognition.locateimage.image.PixelBuffer;
import ai.kognition.locateimage.image.geometry.Region;

public class LocateImageToolTest {
    private static final Color BLUE = new Color(0, 0, 255);
    private static final Color NEAR_BLUE = new Color(0, 0, 250);

    @Rule
    public TemporaryFolder tempDir = new TemporaryFolder();

    private String canvasFile;
    private String sampleFile;
    private String nearSampleFile;
    private String redSampleFile;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private static PixelBuffer solid(final int width, final int height, final Color color) {
        final PixelBuffer ret = PixelBuffer.allocate(width, height);
        ret.fill(ret.bounds(), color);
        return ret;
    }

    private String write(final PixelBuffer buffer, final String name) throws IOException {
        final String ret = new File(tempDir.getRoot(), name).getAbsolutePath();
        ImageFile.writePixelBuffer(buffer, ret);
        return ret;
    }

    @Before
    public void writeImages() throws IOException {
        final PixelBuffer canvas = solid(40, 30, Color.WHITE);
        canvas.fill(new Region(10, 12, 5, 4), BLUE);
        canvas.fill(new Region(30, 2, 5, 4), BLUE);
        canvasFile = write(canvas, "canvas.png");
        sampleFile = write(solid(5, 4, BLUE), "sample.png");
        nearSampleFile = write(solid(5, 4, NEAR_BLUE), "near.png");
        redSampleFile = write(solid(5, 4, Color.RED), "red.png");
    }

    private int run(final String... args) {
        return new LocateImageTool().run(args, new PrintStream(outBytes, true), new PrintStream(errBytes, true));
    }

    private String[] outLines() {
        final String out = new String(outBytes.toByteArray(), StandardCharsets.UTF_8).trim();
        return out.isEmpty() ? new String[0] : out.split("\\R");
    }

    @Test
    public void testFindAll() {
        assertEquals(LocateImageTool.EXIT_FOUND, run("-canvas", canvasFile, "-sample", sampleFile));
        assertArrayEquals(new String[] {"(30,2)+(5x4) 100.0000%", "(10,12)+(5x4) 100.0000%"}, outLines());
    }

    @Test
    public void testFindFirst() {
        assertEquals(LocateImageTool.EXIT_FOUND, run("-canvas", canvasFile, "-sample", sampleFile, "-selection", "first"));
        assertArrayEquals(new String[] {"(30,2)+(5x4) 100.0000%"}, outLines());
    }

    @Test
    public void testUniqueWithTwoMatches() {
        assertEquals(LocateImageTool.EXIT_NOT_FOUND, run("-canvas", canvasFile, "-sample", sampleFile, "-selection", "unique", "-parallelism", "3"));
        assertArrayEquals(new String[] {"(30,2)+(5x4) 100.0000%"}, outLines());
    }

    @Test
    public void testNotFound() {
        assertEquals(LocateImageTool.EXIT_NOT_FOUND, run("-canvas", canvasFile, "-sample", redSampleFile, "-tolerance", "0.1"));
        assertEquals(0, outLines().length);

        assertEquals(LocateImageTool.EXIT_NOT_FOUND, run("-canvas", canvasFile, "-sample", redSampleFile, "-selection", "best"));
        assertEquals(0, outLines().length);
    }

    @Test
    public void testToleranceFromConfigFile() throws IOException {
        assertEquals(LocateImageTool.EXIT_NOT_FOUND, run("-canvas", canvasFile, "-sample", nearSampleFile));

        final File config = tempDir.newFile("locate.properties");
        FileUtils.writeStringToFile(config, "locate.tolerance=0.01\nlocate.parallelism=2\n", StandardCharsets.UTF_8);

        assertEquals(LocateImageTool.EXIT_FOUND, run("-canvas", canvasFile, "-sample", nearSampleFile, "-config", config.getAbsolutePath()));
        assertEquals(2, outLines().length);
    }

    @Test
    public void testCommandLineOverridesConfigFile() throws IOException {
        final File config = tempDir.newFile("strict.properties");
        FileUtils.writeStringToFile(config, "locate.tolerance=0.01\n", StandardCharsets.UTF_8);

        assertEquals(LocateImageTool.EXIT_NOT_FOUND,
            run("-canvas", canvasFile, "-sample", nearSampleFile, "-config", config.getAbsolutePath(), "-tolerance", "0"));
    }

    @Test
    public void testUsageErrors() {
        assertEquals(LocateImageTool.EXIT_ERROR, run("-canvas", canvasFile));
        assertEquals(LocateImageTool.EXIT_ERROR, run("-help"));
        assertEquals(LocateImageTool.EXIT_ERROR, run("-canvas", canvasFile, "-sample", sampleFile, "-tolerance", "lots"));
        assertEquals(LocateImageTool.EXIT_ERROR, run("-canvas", canvasFile, "-sample", sampleFile, "-tolerance", "3"));
        assertEquals(LocateImageTool.EXIT_ERROR, run("-canvas", canvasFile, "-sample", sampleFile, "-selection", "worst"));
        assertEquals(LocateImageTool.EXIT_ERROR, run("-canvas", canvasFile, "-sample", sampleFile, "-tolerance", "0.1", "0.2"));
        assertEquals(0, outLines().length);
        assertTrue(new String(errBytes.toByteArray(), StandardCharsets.UTF_8).contains("usage:"));
    }

    @Test
    public void testIoErrors() throws IOException {
        assertEquals(LocateImageTool.EXIT_ERROR, run("-canvas", new File(tempDir.getRoot(), "missing.png").getAbsolutePath(), "-sample", sampleFile));
        assertEquals(LocateImageTool.EXIT_ERROR, run("-canvas", canvasFile, "-sample", sampleFile, "-config", "/no/such/locate.properties"));

        final File notAnImage = tempDir.newFile("notes.png");
        FileUtils.writeStringToFile(notAnImage, "not a png", StandardCharsets.UTF_8);
        assertEquals(LocateImageTool.EXIT_ERROR, run("-canvas", notAnImage.getAbsolutePath(), "-sample", sampleFile));
    }

    @Test
    public void testMark() throws IOException {
        final String out = new File(tempDir.getRoot(), "marked.png").getAbsolutePath();
        assertEquals(LocateImageTool.EXIT_FOUND, run("-canvas", canvasFile, "-sample", sampleFile, "-out", out));

        final PixelBuffer marked = ImageFile.readPixelBuffer(out);
        assertEquals(0xff00ffff, marked.getRGBA(10, 12));
        assertEquals(0xff00ffff, marked.getRGBA(14, 15));
        // the inside of the outline is untouched
        assertEquals(0x0000ffff, marked.getRGBA(12, 13));
        assertEquals(0xffffffff, marked.getRGBA(0, 0));
    }

    @Test
    public void testMarkedFilename() {
        assertEquals("/images/screen-matches.png", LocateImageTool.markedFilename("/images/screen.jpg"));
        assertEquals("screen-matches.png", LocateImageTool.markedFilename("screen.png"));
    }
}
