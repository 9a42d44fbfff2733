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
 * A {@link MatchVisitor} failed, either by returning {@link VisitResult#fail(Throwable)} or by
 * throwing. The visitor's failure is the {@link #getCause() cause}.
 */
public class CallbackFailedException extends LocateException {
    private static final long serialVersionUID = -7810496254178130226L;

    private final Match match;

    public CallbackFailedException(final Match match, final Throwable cause) {
        super("The match visitor failed on " + match + ": " + cause, cause);
        this.match = match;
    }

    /**
     * The match that was being visited when the visitor failed.
     */
    public Match getMatch() {
        return match;
    }
}
