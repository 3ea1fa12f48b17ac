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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.grack.nanojson.JsonArray;
import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;

/**
 * Loads a {@link CryptoConfig} from JSON of the form:
 * <pre>{@code
 * {
 *   "data_at_rest": {
 *     "active_encryption_suite_id": "HYBRID-A",
 *     "decryption_attempt_order": ["HYBRID-A", "LEGACY-OPENPGP"],
 *     "suites": {
 *       "HYBRID-A": {
 *         "type": "HYBRID",
 *         "classical_kem_algorithm": "X25519",
 *         "pqc_kem_algorithm": "ML-KEM-768",
 *         "symmetric_algorithm": "AES256GCM",
 *         "kdf_algorithm_for_hybrid_sk": "HKDF-SHA256",
 *         "pbkdf_algorithm": "Argon2id",
 *         "pbkdf_parameters": { "memory_kib": 65536, "iterations": 3, "parallelism": 1 },
 *         "kdf_algorithm_for_passphrase": "HKDF-SHA3-512"
 *       },
 *       "LEGACY-OPENPGP": { "type": "LEGACY_OPENPGP" }
 *     }
 *   }
 * }
 * }</pre>
 * The PBKDF settings are optional and default to Argon2id with {@link PbkdfParameters#ARGON2ID_DEFAULTS}.
 */
public final class CryptoConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(CryptoConfigLoader.class);

    static final String DEFAULT_RESOURCE = "/io/agilecrypt/default-crypto-settings.json";

    private CryptoConfigLoader() {}

    /**
     * Loads the built-in default configuration.
     *
     * @return the default configuration.
     */
    public static CryptoConfig loadDefault() {
        try (var in = CryptoConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("Default crypto settings not found on classpath");
            }
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read default crypto settings", e);
        }
    }

    public static CryptoConfig load(Path file) throws IOException {
        try (var in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    /**
     * Parses and validates a configuration.
     *
     * @param in the JSON input. Not closed.
     * @return the configuration.
     * @throws ConfigurationException if the JSON is malformed, a required setting is missing, or the settings are
     * inconsistent.
     */
    public static CryptoConfig load(InputStream in) {
        JsonObject root;
        try {
            root = JsonParser.object().from(in);
        } catch (JsonParserException e) {
            throw new ConfigurationException("Crypto settings are not valid JSON: " + e.getMessage(), e);
        }
        var dataAtRest = requireObject(root, "data_at_rest", "settings");
        var activeSuiteId = requireString(dataAtRest, "active_encryption_suite_id", "data_at_rest");
        var attemptOrder = requireStringList(dataAtRest, "decryption_attempt_order");

        var suitesJson = requireObject(dataAtRest, "suites", "data_at_rest");
        var suites = new ArrayList<SuiteDefinition>();
        for (var suiteId : suitesJson.keySet()) {
            var suiteJson = suitesJson.getObject(suiteId);
            if (suiteJson == null) {
                throw new ConfigurationException("Settings for suite '" + suiteId + "' must be an object");
            }
            suites.add(parseSuite(suiteId, suiteJson));
        }

        var config = new CryptoConfig(activeSuiteId, attemptOrder, suites);
        logger.info("Loaded crypto settings: active suite {}, {} suites, attempt order {}", activeSuiteId,
                suites.size(), attemptOrder);
        return config;
    }

    private static SuiteDefinition parseSuite(String suiteId, JsonObject json) {
        var typeName = requireString(json, "type", suiteId);
        SuiteType type;
        try {
            type = SuiteType.valueOf(typeName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown type '" + typeName + "' for suite '" + suiteId + "'", e);
        }
        var builder = SuiteDefinition.builder(suiteId, type)
                .description(json.getString("description", ""));
        if (type == SuiteType.HYBRID) {
            builder.classicalKem(json.getString("classical_kem_algorithm"))
                    .pqcKem(json.getString("pqc_kem_algorithm"))
                    .symmetricCipher(json.getString("symmetric_algorithm"))
                    .hybridKdf(json.getString("kdf_algorithm_for_hybrid_sk"));
            if (json.has("pbkdf_algorithm") || json.has("pbkdf_parameters")) {
                builder.pbkdf(json.getString("pbkdf_algorithm", "Argon2id"),
                        parsePbkdfParameters(json.getObject("pbkdf_parameters")));
            }
            if (json.has("kdf_algorithm_for_passphrase")) {
                builder.passphraseKdf(json.getString("kdf_algorithm_for_passphrase"));
            }
        }
        return builder.build();
    }

    private static PbkdfParameters parsePbkdfParameters(JsonObject json) {
        if (json == null) {
            return PbkdfParameters.ARGON2ID_DEFAULTS;
        }
        var defaults = PbkdfParameters.ARGON2ID_DEFAULTS;
        return new PbkdfParameters(
                json.getInt("memory_kib", defaults.memoryKiB()),
                json.getInt("iterations", defaults.iterations()),
                json.getInt("parallelism", defaults.parallelism()));
    }

    private static JsonObject requireObject(JsonObject json, String key, String context) {
        var value = json.getObject(key);
        if (value == null) {
            throw new ConfigurationException("Missing '" + key + "' section in " + context);
        }
        return value;
    }

    private static String requireString(JsonObject json, String key, String context) {
        var value = json.getString(key);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing required setting '" + key + "' in " + context);
        }
        return value;
    }

    private static List<String> requireStringList(JsonObject json, String key) {
        JsonArray array = json.getArray(key);
        if (array == null) {
            throw new ConfigurationException("Missing required setting '" + key + "' in data_at_rest");
        }
        var result = new ArrayList<String>();
        for (int i = 0; i < array.size(); i++) {
            var value = array.getString(i);
            if (value == null) {
                throw new ConfigurationException("'" + key + "' must only contain suite ids");
            }
            result.add(value);
        }
        return result;
    }
}
