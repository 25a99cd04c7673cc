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
package ru.nts.tools.cast.chunk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Чанк после пакетного сжатия.
 *
 * @param chunk исходный чанк
 * @param compressedCode псевдокод (или исходный код, если сжатие выключено)
 * @param metadata метаданные чанка, дополненные полями uses_cast и cast_*
 */
public record CompressedChunk(CodeChunk chunk, String compressedCode, Map<String, Object> metadata) {

    public CompressedChunk {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean usesCast() {
        return Boolean.TRUE.equals(metadata.get(ChunkCompressor.USES_CAST));
    }

    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", chunk.id());
        node.put("code", chunk.code());
        node.put("compressed_code", compressedCode);
        node.set("metadata", mapper.valueToTree(metadata));
        return node;
    }
}
