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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import io.agilecrypt.config.SuiteDefinition;

final class StaticKeySource implements KeySource {
    private final Map<String, KeyMaterial> keysBySuite = new LinkedHashMap<>();

    StaticKeySource(KeyMaterial... keyMaterial) {
        for (var keys : keyMaterial) {
            keysBySuite.put(keys.getSuiteId(), keys.copy());
        }
    }

    @Override
    public KeyMaterial keysForEncryption(SuiteDefinition suite) {
        return lookup(suite).publicKeysOnly();
    }

    @Override
    public KeyMaterial keysForDecryption(SuiteDefinition suite, Optional<byte[]> passphraseSalt) {
        var keys = lookup(suite);
        if (!keys.hasPrivateKeys()) {
            throw new InvalidKeyMaterialException("No private keys loaded for suite " + suite.getId());
        }
        return keys.copy();
    }

    private KeyMaterial lookup(SuiteDefinition suite) {
        var keys = keysBySuite.get(suite.getId());
        if (keys == null) {
            throw new InvalidKeyMaterialException("No keys loaded for suite " + suite.getId());
        }
        return keys;
    }
}
