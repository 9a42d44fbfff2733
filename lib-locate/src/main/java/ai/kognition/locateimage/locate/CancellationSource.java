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

import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link Cancellation} that's triggered by calling {@link #cancel()}. It's safe to cancel from any
 * thread. Only the first cancellation's reason is kept.
 */
public class CancellationSource implements Cancellation {
    private final AtomicReference<String> cause = new AtomicReference<>(null);

    public void cancel() {
        cancel(CANCELED);
    }

    public void cancel(final String reason) {
        cause.compareAndSet(null, reason == null ? CANCELED : reason);
    }

    @Override
    public boolean isCancelled() {
        return cause.get() != null;
    }

    @Override
    public String cause() {
        return cause.get();
    }

    @Override
    public String toString() {
        final String c = cause.get();
        return c == null ? "CancellationSource [not cancelled]" : "CancellationSource [" + c + "]";
    }
}
