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

package io.agilecrypt.config;

/**
 * The kind of handler that implements a suite.
 */
public enum SuiteType {
    /**
     * Classical KEM combined with a post-quantum KEM, protecting the data with an AEAD cipher. The only type used for
     * new encryptions.
     */
    HYBRID,
    /**
     * Decrypt-only support for OpenPGP password-encrypted messages written before hybrid encryption was introduced.
     */
    LEGACY_OPENPGP
}
