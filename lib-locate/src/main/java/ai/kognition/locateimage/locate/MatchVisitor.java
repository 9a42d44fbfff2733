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

import java.util.function.Consumer;

/**
 * Receives matches from a scan in row major order. Throwing a {@link RuntimeException} from
 * {@link #visit(Match)} is the same as returning {@link VisitResult#fail(Throwable)}.
 */
@FunctionalInterface
public interface MatchVisitor {
    public VisitResult visit(Match match);

    /**
     * A visitor that hands every match to {@code consumer} and never stops the scan.
     */
    public static MatchVisitor each(final Consumer<Match> consumer) {
        return m -> {
            consumer.accept(m);
            return VisitResult.CONTINUE;
        };
    }
}
