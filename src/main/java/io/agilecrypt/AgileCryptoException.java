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
 * Base class of all errors raised by the library. All subclasses are unchecked: callers that want to distinguish
 * failure modes catch the specific subclass.
 */
public class AgileCryptoException extends RuntimeException {
    public AgileCryptoException(String message) {
        super(message);
    }

    public AgileCryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
