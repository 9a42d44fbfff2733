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

import java.util.Locale;

/**
 * How {@link Locator#findOne} picks the single match it returns.
 */
public enum Selection {
    /**
     * Whatever match is encountered first in the scan. The scan stops as soon as it's found.
     */
    FIRST_ENCOUNTERED("first", "fastest"),

    /**
     * The match with the highest similarity. Of equally similar matches, the first one in
     * the scan is kept. The whole canvas is scanned.
     */
    BEST_OVERALL("best"),

    /**
     * Like {@link #BEST_OVERALL} but also checks that there's only one match. If there's more
     * than one a {@link MultipleMatchesException} carrying the best match is thrown.
     */
    BEST_OVERALL_UNIQUE("unique", "only");

    private final String[] aliases;

    private Selection(final String... aliases) {
        this.aliases = aliases;
    }

    /**
     * Look up a {@link Selection} by name ({@code BEST_OVERALL}) or by alias ({@code best}), ignoring case.
     *
     * @throws IllegalArgumentException if the name isn't recognized.
     */
    public static Selection parse(final String name) {
        if(name == null)
            throw new IllegalArgumentException("No selection given");
        final String n = name.trim();
        for(final Selection s: values()) {
            if(s.name().equalsIgnoreCase(n))
                return s;
            for(final String alias: s.aliases) {
                if(alias.equals(n.toLowerCase(Locale.ROOT)))
                    return s;
            }
        }
        throw new IllegalArgumentException("Unknown selection \"" + name + "\". Use one of first, best or unique.");
    }
}
