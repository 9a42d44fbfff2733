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
 * Base of the exceptions a search can end with.
 */
public class LocateException extends RuntimeException {
    private static final long serialVersionUID = 6018457249366217093L;

    public LocateException(final String msg) {
        super(msg);
    }

    public LocateException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
