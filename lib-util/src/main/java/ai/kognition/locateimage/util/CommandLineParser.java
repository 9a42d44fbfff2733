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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * <p>
 * Parses a command line of the form
 * </p>
 *
 * <pre>
 * java LocateImageTool -canvas screen.png -sample button.png -tolerance 0.05 -verbose extra
 * </pre>
 *
 * <p>
 * into a map from option name (without the leading dash) to value. An option that isn't followed
 * by a value maps to {@code "true"}. Arguments that aren't associated with an option are collected
 * separately and are available from {@link #getNonOptionArgs()}.
 * </p>
 *
 * <p>
 * A token starting with a dash followed by a digit (for example {@code -1}) is treated as a value
 * rather than as the next option.
 * </p>
 */
public class CommandLineParser extends HashMap<String, String> {
    private static final long serialVersionUID = 4519372946612093385L;

    private final List<String> nonOptionArgs = new ArrayList<>();

    public CommandLineParser(final String[] args) {
        parse(args);
    }

    public List<String> getNonOptionArgs() {
        return Collections.unmodifiableList(nonOptionArgs);
    }

    public String getProperty(final String key) {
        return get(key);
    }

    public String getProperty(final String key, final String defaultValue) {
        final String ret = get(key);
        return ret == null ? defaultValue : ret;
    }

    public boolean hasOption(final String key) {
        return containsKey(key);
    }

    /**
     * @throws IllegalArgumentException if the option is present but isn't an integer.
     */
    public int getInt(final String key, final int defaultValue) {
        final String val = get(key);
        if(val == null)
            return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The option \"-" + key + "\" requires an integer but was given \"" + val + "\"", nfe);
        }
    }

    /**
     * @throws IllegalArgumentException if the option is present but isn't a number.
     */
    public double getDouble(final String key, final double defaultValue) {
        final String val = get(key);
        if(val == null)
            return defaultValue;
        try {
            return Double.parseDouble(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The option \"-" + key + "\" requires a number but was given \"" + val + "\"", nfe);
        }
    }

    /**
     * Reconstructs an equivalent command line. The order of the options isn't
     * preserved and options without a value are rendered as {@code -option true}.
     */
    public String reconstructCommandLine() {
        final StringBuilder ret = new StringBuilder();

        for(final String arg: nonOptionArgs)
            ret.append(' ').append(arg);

        for(final Map.Entry<String, String> nv: entrySet()) {
            ret.append(" -").append(nv.getKey());
            final String val = nv.getValue();
            if(val != null && val.length() > 0)
                ret.append(' ').append(val);
        }

        return ret.toString();
    }

    private static boolean isOption(final String arg) {
        return arg.length() > 1 && arg.charAt(0) == '-' && !Character.isDigit(arg.charAt(1)) && arg.charAt(1) != '.';
    }

    private void parse(final String[] args) {
        if(args == null)
            return;

        for(int i = 0; i < args.length; i++) {
            final String cur = args[i] == null ? "" : args[i].trim();
            if(cur.length() == 0)
                continue;

            if(isOption(cur)) {
                final String name = cur.substring(1);
                String val = null;

                if(i + 1 < args.length && args[i + 1] != null) {
                    final String next = args[i + 1].trim();
                    // the next token is the value unless it's the next option.
                    if(next.length() > 0 && !isOption(next)) {
                        val = next;
                        i++;
                    }
                }

                put(name, val == null ? "true" : val);
            } else
                nonOptionArgs.add(cur);
        }
    }
}
