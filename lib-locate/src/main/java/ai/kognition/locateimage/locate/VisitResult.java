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
 * What a {@link MatchVisitor} wants the scan to do after it has seen a match.
 */
public final class VisitResult {
    public static enum Kind {
        CONTINUE, STOP, FAIL
    }

    /**
     * Keep scanning.
     */
    public static final VisitResult CONTINUE = new VisitResult(Kind.CONTINUE, null);

    /**
     * End the scan. This isn't an error: the search returns normally.
     */
    public static final VisitResult STOP = new VisitResult(Kind.STOP, null);

    private final Kind kind;
    private final Throwable cause;

    private VisitResult(final Kind kind, final Throwable cause) {
        this.kind = kind;
        this.cause = cause;
    }

    /**
     * End the scan with an error. The search throws a {@link CallbackFailedException} whose
     * cause is {@code cause}.
     */
    public static VisitResult fail(final Throwable cause) {
        if(cause == null)
            throw new IllegalArgumentException("A failed visit needs a cause");
        return new VisitResult(Kind.FAIL, cause);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The failure for {@link Kind#FAIL}, otherwise null.
     */
    public Throwable cause() {
        return cause;
    }

    @Override
    public String toString() {
        return cause == null ? kind.name() : kind.name() + "(" + cause + ")";
    }
}
