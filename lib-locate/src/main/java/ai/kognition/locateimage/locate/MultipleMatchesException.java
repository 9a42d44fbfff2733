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

/**
 * Thrown from a {@link Selection#BEST_OVERALL_UNIQUE} search that found more than one match. The
 * best match is still available from {@link #getBestMatch()}.
 */
public class MultipleMatchesException extends LocateException {
    private static final long serialVersionUID = 2775436208186547301L;

    private final Match bestMatch;
    private final int matchCount;

    public MultipleMatchesException(final Match bestMatch, final int matchCount) {
        super("Found " + matchCount + " matches where one was expected. The best is " + bestMatch);
        this.bestMatch = bestMatch;
        this.matchCount = matchCount;
    }

    public Match getBestMatch() {
        return bestMatch;
    }

    public int getMatchCount() {
        return matchCount;
    }
}
