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
 * Thrown when encrypted data does not have the format or suite that a handler expects. This is a recoverable
 * condition: the {@link AgileOrchestrator} reacts to it by trying the next handler.
 */
public class FormatMismatchException extends AgileCryptoException {
    public FormatMismatchException(String message) {
        super(message);
    }

    public FormatMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
