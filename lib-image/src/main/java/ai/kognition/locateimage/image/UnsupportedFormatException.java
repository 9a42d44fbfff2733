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

package ai.kognition.locateimage.image;

/**
 * Thrown when pixel data isn't, and can't be made into, the canonical layout held
 * by a {@link PixelBuffer}.
 */
public class UnsupportedFormatException extends RuntimeException {
    private static final long serialVersionUID = -3581960294711658021L;

    public UnsupportedFormatException(final String msg) {
        super(msg);
    }

    public UnsupportedFormatException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
