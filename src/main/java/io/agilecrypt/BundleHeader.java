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
 * The self-describing prefix of an encrypted bundle: enough to tell which handler produced it without parsing the
 * rest.
 *
 * @param version  the bundle format version.
 * @param formatId the format identifier, such as {@link BundleCodec#HYBRID_FORMAT_ID}.
 * @param suiteId  the id of the suite that encrypted the data.
 */
public record BundleHeader(int version, String formatId, String suiteId) {}
