/*
 * Copyright (c) 2026 MakiBytes.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.faultlens.gate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;

/**
 * Order-independent identity of a top feature set.
 */
public record FeatureFingerprint(List<String> features, String digest) {

    public static FeatureFingerprint of(Collection<String> features) {
        List<String> sorted = features.stream().distinct().sorted().toList();
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest(String.join("|", sorted).getBytes(StandardCharsets.UTF_8));
            return new FeatureFingerprint(sorted, HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public double similarity(FeatureFingerprint other) {
        if (other == null) {
            return 0.0;
        }
        if (digest.equals(other.digest)) {
            return 1.0;
        }
        return FeatureRanker.jaccard(features, other.features);
    }
}
