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

import java.awt.Color;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import ai.kognition.locateimage.image.ImageFile;
import ai.kognition.locateimage.image.PixelBuffer;
import ai.kognition.locateimage.image.UnsupportedFormatException;
import ai.kognition.locateimage.image.geometry.Region;
import ai.kognition.locateimage.locate.LocateCancelledException;
import ai.kognition.locateimage.locate.LocateConfig;
import ai.kognition.locateimage.locate.Locator;
import ai.kognition.locateimage.locate.Match;
import ai.kognition.locateimage.locate.MatchNotFoundException;
import ai.kognition.locateimage.locate.MultipleMatchesException;
import ai.kognition.locateimage.locate.Selection;
import ai.kognition.locateimage.util.CommandLineParser;
import ai.kognition.locateimage.util.PropertiesUtils;
import ai.kognition.locateimage.util.Timer;

/**
 * <p>
 * Searches one image file for another and prints each match on its own line:
 * </p>
 *
 * <pre>
 * java ai.kognition.locateimage.tool.LocateImageTool -canvas screen.png -sample button.png -tolerance 0.05
 * </pre>
 *
 * <p>
 * Settings come from {@code locateimage.properties} on the classpath, then the file given with
 * {@code -config}, then the command line. Without {@code -selection} every match is printed.
 * With {@code -mark} a copy of the canvas with the matches outlined is written next to the canvas
 * (or to the file given with {@code -out}).
 * </p>
 */
public class LocateImageTool {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocateImageTool.class);

    public static final int EXIT_FOUND = 0;
    public static final int EXIT_NOT_FOUND = 1;
    public static final int EXIT_ERROR = 2;

    public static final String ALL = "all";

    private static final Color MARK_COLOR = Color.MAGENTA;

    private String canvasFilename;
    private String sampleFilename;
    private String selection;
    private String markFilename;
    private LocateConfig config;

    public static void main(final String[] args) {
        SLF4JBridgeHandler.removeHandlersForRootLogger();
        SLF4JBridgeHandler.install();

        System.exit(new LocateImageTool().run(args, System.out, System.err));
    }

    /**
     * @return the process exit code. {@link #EXIT_FOUND}, {@link #EXIT_NOT_FOUND} or {@link #EXIT_ERROR}.
     */
    public int run(final String[] args, final PrintStream out, final PrintStream err) {
        try {
            if(!commandLine(args, err))
                return EXIT_ERROR;
        } catch(final IllegalArgumentException iae) {
            err.println(iae.getMessage());
            usage(err);
            return EXIT_ERROR;
        }

        final PixelBuffer canvas;
        final PixelBuffer sample;
        try {
            canvas = ImageFile.readPixelBuffer(canvasFilename);
            sample = ImageFile.readPixelBuffer(sampleFilename);
        } catch(final FileNotFoundException | UnsupportedFormatException e) {
            err.println(e.getMessage());
            return EXIT_ERROR;
        } catch(final IOException ioe) {
            LOGGER.error("Failed to read the images", ioe);
            err.println("Failed to read the images: " + ioe);
            return EXIT_ERROR;
        }

        final Timer timer = Timer.started();
        final Locator locator = new Locator(config);
        List<Match> matches;
        int ret;
        try {
            if(ALL.equals(selection))
                matches = locator.findAll(canvas, sample);
            else
                matches = Collections.singletonList(locator.findOne(canvas, sample));
            ret = matches.isEmpty() ? EXIT_NOT_FOUND : EXIT_FOUND;
        } catch(final MatchNotFoundException mnfe) {
            err.println(mnfe.getMessage());
            matches = Collections.emptyList();
            ret = EXIT_NOT_FOUND;
        } catch(final MultipleMatchesException mme) {
            err.println(mme.getMessage());
            matches = Collections.singletonList(mme.getBestMatch());
            ret = EXIT_NOT_FOUND;
        } catch(final LocateCancelledException lce) {
            err.println(lce.getMessage());
            matches = lce.getPartialMatches();
            ret = EXIT_NOT_FOUND;
        }
        LOGGER.info("Found {} matches of {} in {} in {} seconds", matches.size(), sampleFilename, canvasFilename, timer.stop());

        for(final Match m: matches)
            out.println(m);

        if(markFilename != null && !matches.isEmpty()) {
            try {
                ImageFile.writePixelBuffer(mark(canvas, matches), markFilename);
                LOGGER.info("Wrote the marked canvas to {}", markFilename);
            } catch(final IOException | UnsupportedFormatException e) {
                err.println("Failed to write " + markFilename + ": " + e.getMessage());
                return EXIT_ERROR;
            }
        }
        return ret;
    }

    /**
     * The default name for the marked copy of {@code canvasFilename}: {@code dir/name-matches.png}.
     */
    public static String markedFilename(final String canvasFilename) {
        return FilenameUtils.getFullPath(canvasFilename) + FilenameUtils.getBaseName(canvasFilename) + "-matches.png";
    }

    private static PixelBuffer mark(final PixelBuffer canvas, final List<Match> matches) {
        final PixelBuffer ret = canvas.copy();
        for(final Match m: matches) {
            final Region r = m.getRegion();
            ret.fill(new Region(r.getX(), r.getY(), r.getWidth(), 1), MARK_COLOR);
            ret.fill(new Region(r.getX(), r.maxY() - 1, r.getWidth(), 1), MARK_COLOR);
            ret.fill(new Region(r.getX(), r.getY(), 1, r.getHeight()), MARK_COLOR);
            ret.fill(new Region(r.maxX() - 1, r.getY(), 1, r.getHeight()), MARK_COLOR);
        }
        return ret;
    }

    private static void usage(final PrintStream err) {
        err.println("usage: java [javaargs] " + LocateImageTool.class.getName() + " -canvas file -sample file [-tolerance 0.05]"
            + " [-selection all|first|best|unique] [-timeout millis] [-parallelism n] [-config file] [-mark] [-out file]");
    }

    private boolean commandLine(final String[] args, final PrintStream err) {
        final CommandLineParser cl = new CommandLineParser(args);

        if(cl.hasOption("help") || cl.hasOption("-help")) {
            usage(err);
            return false;
        }

        if(!cl.getNonOptionArgs().isEmpty()) {
            err.println("Unexpected arguments " + cl.getNonOptionArgs());
            usage(err);
            return false;
        }

        canvasFilename = cl.getProperty("canvas");
        sampleFilename = cl.getProperty("sample");
        if(canvasFilename == null || sampleFilename == null) {
            usage(err);
            return false;
        }

        final Properties props = LocateConfig.loadDefaultProperties();
        final String configFile = cl.getProperty("config");
        if(configFile != null && !PropertiesUtils.loadProps(props, configFile)) {
            err.println("Couldn't load the configuration file " + configFile);
            return false;
        }

        LocateConfig conf = LocateConfig.fromProperties(props);
        if(cl.hasOption("tolerance"))
            conf = conf.withTolerance(cl.getDouble("tolerance", conf.getTolerance()));
        if(cl.hasOption("parallelism")) {
            final int parallelism = cl.getInt("parallelism", conf.getParallelism());
            conf = conf.withParallelism(parallelism == 0 ? Runtime.getRuntime().availableProcessors() : parallelism);
        }
        if(cl.hasOption("timeout"))
            conf = conf.withTimeout(Duration.ofMillis(cl.getInt("timeout", 0)));

        selection = cl.getProperty("selection", ALL).trim().toLowerCase(Locale.ROOT);
        if(!ALL.equals(selection))
            conf = conf.withSelection(Selection.parse(selection));
        config = conf;

        if(cl.hasOption("out"))
            markFilename = cl.getProperty("out");
        else if(cl.hasOption("mark"))
            markFilename = markedFilename(canvasFilename);

        LOGGER.debug("Running with{}", cl.reconstructCommandLine());
        LOGGER.debug("Using {}", config);
        return true;
    }
}
