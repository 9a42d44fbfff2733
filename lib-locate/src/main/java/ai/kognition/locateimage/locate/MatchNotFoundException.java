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
 * The whole canvas was scanned (or there was nothing to scan) and the sample wasn't found.
 */
public class MatchNotFoundException extends LocateException {
    private static final long serialVersionUID = -1530214569824311709L;

    public MatchNotFoundException(final String msg) {
        super(msg);
    }
}
