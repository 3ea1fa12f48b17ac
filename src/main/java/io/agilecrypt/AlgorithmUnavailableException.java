/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.agilecrypt;

/**
 * Indicates that a requested algorithm is not available from the {@link AlgorithmProvider}, or that a handler for a
 * suite could not be constructed. This is fatal when registering a suite.
 */
public class AlgorithmUnavailableException extends AgileCryptoException {
    public AlgorithmUnavailableException(String message) {
        super(message);
    }

    public AlgorithmUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
