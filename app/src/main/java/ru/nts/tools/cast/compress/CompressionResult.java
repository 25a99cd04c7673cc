/*
 * Copyright 2025 Aristo
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
 */
package ru.nts.tools.cast.compress;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Результат сжатия.
 *
 * @param compressedCode псевдокод (или исходный текст в режиме passthrough)
 * @param originalCode исходный текст без изменений
 * @param compressionRatio отношение токенов сжатого к исходному (1.0 в режиме passthrough)
 * @param stats подробная статистика
 */
public record CompressionResult(
        String compressedCode,
        String originalCode,
        double compressionRatio,
        CompressionStats stats
) {

    static CompressionResult passthrough(String code, String error) {
        return new CompressionResult(code, code, 1.0, CompressionStats.degraded(error));
    }

    public boolean isDegraded() {
        return stats.isDegraded();
    }

    /**
     * JSON представление с ключами compressed_code, original_code, compression_ratio, stats.
     */
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("compressed_code", compressedCode);
        node.put("original_code", originalCode);
        node.put("compression_ratio", compressionRatio);
        node.set("stats", mapper.valueToTree(stats.toMap()));
        return node;
    }
}
