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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.locateimage.util.PropertiesUtils;

/**
 * <p>
 * Settings for a {@link Locator}. They're read from the {@value #SECTION} section of a
 * {@link Properties}:
 * </p>
 *
 * <ul>
 * <li>{@code locate.tolerance} the tolerance used when a call doesn't give one.</li>
 * <li>{@code locate.selection} the {@link Selection} used when a call doesn't give one.</li>
 * <li>{@code locate.parallelism} the number of threads scanning rows. 0 means one per processor.</li>
 * <li>{@code locate.timeoutMillis} a deadline applied to every search. 0 or less means none.</li>
 * </ul>
 *
 * <p>
 * {@link #defaults()} reads {@value #DEFAULTS_RESOURCE} from the classpath.
 * </p>
 */
public final class LocateConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocateConfig.class);

    public static final String SECTION = "locate";
    public static final String DEFAULTS_RESOURCE = "locateimage.properties";

    public static final String TOLERANCE = "tolerance";
    public static final String SELECTION = "selection";
    public static final String PARALLELISM = "parallelism";
    public static final String TIMEOUT_MILLIS = "timeoutMillis";

    private final double tolerance;
    private final Selection selection;
    private final int parallelism;
    private final Duration timeout;

    private LocateConfig(final double tolerance, final Selection selection, final int parallelism, final Duration timeout) {
        SimilarityMetric.checkTolerance(tolerance);
        if(selection == null)
            throw new IllegalArgumentException("A selection is required");
        if(parallelism < 1)
            throw new IllegalArgumentException("The parallelism must be at least 1 but was " + parallelism);
        this.tolerance = tolerance;
        this.selection = selection;
        this.parallelism = parallelism;
        this.timeout = timeout;
    }

    /**
     * Exact matching of the best match, on the calling thread, with no timeout. This doesn't look
     * at the classpath.
     */
    public static LocateConfig builtIn() {
        return new LocateConfig(0.0, Selection.BEST_OVERALL, 1, null);
    }

    /**
     * The built in settings overridden by {@value #DEFAULTS_RESOURCE} if it's on the classpath.
     *
     * @throws UncheckedIOException if the resource exists but can't be read.
     */
    public static LocateConfig defaults() {
        return fromProperties(loadDefaultProperties());
    }

    /**
     * The contents of {@value #DEFAULTS_RESOURCE}, empty if it isn't on the classpath.
     */
    public static Properties loadDefaultProperties() {
        final Properties props = new Properties();
        try {
            PropertiesUtils.loadResource(props, DEFAULTS_RESOURCE);
        } catch(final IOException ioe) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, ioe);
        }
        return props;
    }

    /**
     * Read the settings from the {@value #SECTION} section of {@code props}. Missing settings
     * take their {@link #builtIn()} values.
     *
     * @throws IllegalArgumentException if a setting is present but invalid.
     */
    public static LocateConfig fromProperties(final Properties props) {
        final Properties section = PropertiesUtils.getSection(props, SECTION, true);
        final LocateConfig builtIn = builtIn();

        final double tolerance = PropertiesUtils.getDouble(section, TOLERANCE, builtIn.tolerance);

        final String selectionStr = section.getProperty(SELECTION);
        final Selection selection = StringUtils.isBlank(selectionStr) ? builtIn.selection : Selection.parse(selectionStr);

        final long parallelismSetting = PropertiesUtils.getLong(section, PARALLELISM, builtIn.parallelism);
        if(parallelismSetting < 0 || parallelismSetting > Integer.MAX_VALUE)
            throw new IllegalArgumentException("The property \"" + SECTION + PropertiesUtils.separator + PARALLELISM + "\" can't be " + parallelismSetting);
        final int parallelism = parallelismSetting == 0 ? Runtime.getRuntime().availableProcessors() : (int)parallelismSetting;

        final long timeoutMillis = PropertiesUtils.getLong(section, TIMEOUT_MILLIS, 0L);
        final Duration timeout = timeoutMillis <= 0 ? null : Duration.ofMillis(timeoutMillis);

        final LocateConfig ret = new LocateConfig(tolerance, selection, parallelism, timeout);
        LOGGER.debug("Loaded {}", ret);
        return ret;
    }

    public double getTolerance() {
        return tolerance;
    }

    public Selection getSelection() {
        return selection;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * The deadline applied to every search, or null if there isn't one.
     */
    public Duration getTimeout() {
        return timeout;
    }

    public LocateConfig withTolerance(final double newTolerance) {
        return new LocateConfig(newTolerance, selection, parallelism, timeout);
    }

    public LocateConfig withSelection(final Selection newSelection) {
        return new LocateConfig(tolerance, newSelection, parallelism, timeout);
    }

    public LocateConfig withParallelism(final int newParallelism) {
        return new LocateConfig(tolerance, selection, newParallelism, timeout);
    }

    /**
     * @param newTimeout null, zero or negative for no timeout.
     */
    public LocateConfig withTimeout(final Duration newTimeout) {
        return new LocateConfig(tolerance, selection, parallelism, newTimeout == null || newTimeout.isZero() || newTimeout.isNegative() ? null : newTimeout);
    }

    @Override
    public String toString() {
        return "LocateConfig [tolerance=" + tolerance + ", selection=" + selection + ", parallelism=" + parallelism + ", timeout=" + timeout + "]";
    }
}
