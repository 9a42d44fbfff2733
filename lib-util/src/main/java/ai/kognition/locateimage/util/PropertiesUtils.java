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

package ai.kognition.locateimage.util;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    public static final String separator = ".";

    /**
     * Select the entries of {@code props} whose keys are in the section {@code sectionName}, that is,
     * keys of the form {@code sectionName.something}. If {@code removeSectionName} is set then the
     * section prefix is stripped from the keys of the returned {@link Properties}.
     */
    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();
        final String prefix = sectionName + separator;

        for(final String key: props.stringPropertyNames()) {
            if(key.startsWith(prefix)) {
                final String newkey = removeSectionName ? key.substring(prefix.length()) : key;
                ret.setProperty(newkey, props.getProperty(key));
            } else if(key.equals(sectionName) && !removeSectionName) {
                ret.setProperty(key, props.getProperty(key));
            }
        }

        return ret;
    }

    /**
     * Load the file {@code fname} into {@code p}. Returns false if the file couldn't be read,
     * leaving {@code p} untouched.
     */
    public static boolean loadProps(final Properties p, final String fname) {
        final Properties loaded = new Properties();
        try(InputStream fis = new FileInputStream(fname);) {
            loaded.load(fis);
        } catch(final IOException ioe) {
            LOGGER.warn("Couldn't load properties from {}", fname, ioe);
            return false;
        }

        p.putAll(loaded);
        return true;
    }

    /**
     * Load a properties resource from the classpath into {@code p}. Returns false if the resource
     * doesn't exist.
     *
     * @throws IOException if the resource exists but can't be read.
     */
    public static boolean loadResource(final Properties p, final String resource) throws IOException {
        final ClassLoader cl = Thread.currentThread().getContextClassLoader() == null ? PropertiesUtils.class.getClassLoader()
            : Thread.currentThread().getContextClassLoader();

        try(InputStream is = cl.getResourceAsStream(resource);) {
            if(is == null) {
                LOGGER.debug("No properties resource named {} on the classpath", resource);
                return false;
            }
            p.load(is);
        }
        return true;
    }

    /**
     * Fetch a numeric value, failing with a message that names the key if the value isn't a number.
     */
    public static double getDouble(final Properties p, final String key, final double defaultValue) {
        final String val = p.getProperty(key);
        if(val == null)
            return defaultValue;
        try {
            return Double.parseDouble(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" should be a number but is \"" + val + "\"", nfe);
        }
    }

    public static long getLong(final Properties p, final String key, final long defaultValue) {
        final String val = p.getProperty(key);
        if(val == null)
            return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" should be an integer but is \"" + val + "\"", nfe);
        }
    }
}
