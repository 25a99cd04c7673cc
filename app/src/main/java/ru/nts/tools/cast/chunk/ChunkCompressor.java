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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.cast.compress.CastCompressor;
import ru.nts.tools.cast.compress.CompressionResult;
import ru.nts.tools.cast.compress.CompressionStats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Применяет cAST к набору чанков перед построением эмбеддингов.
 * Если сжатие выключено в настройках (USE_CAST=false), чанки проходят без изменений.
 */
public final class ChunkCompressor {

    private static final Logger log = LoggerFactory.getLogger(ChunkCompressor.class);

    public static final String USES_CAST = "uses_cast";
    public static final String CAST_COMPRESSION_RATIO = "cast_compression_ratio";
    public static final String CAST_CHAR_COMPRESSION_RATIO = "cast_char_compression_ratio";
    public static final String CAST_MERGED_NODES = "cast_merged_nodes";
    public static final String CAST_PRESERVED_NODES = "cast_preserved_nodes";

    private final CastCompressor compressor;

    public ChunkCompressor(CastCompressor compressor) {
        this.compressor = compressor;
    }

    /**
     * Сжимает каждый чанк и дополняет его метаданные.
     *
     * @param chunks исходные чанки
     * @return чанки в том же порядке
     */
    public List<CompressedChunk> apply(List<CodeChunk> chunks) {
        List<CompressedChunk> result = new ArrayList<>(chunks.size());
        if (!compressor.config().enabled()) {
            for (CodeChunk chunk : chunks) {
                Map<String, Object> metadata = new LinkedHashMap<>(chunk.metadata());
                metadata.put(USES_CAST, false);
                result.add(new CompressedChunk(chunk, chunk.code(), metadata));
            }
            return result;
        }

        for (CodeChunk chunk : chunks) {
            CompressionResult compressed = compressor.compress(chunk.code());
            CompressionStats stats = compressed.stats();

            Map<String, Object> metadata = new LinkedHashMap<>(chunk.metadata());
            metadata.put(USES_CAST, true);
            metadata.put(CAST_COMPRESSION_RATIO, compressed.compressionRatio());
            metadata.put(CAST_CHAR_COMPRESSION_RATIO, stats.isDegraded() ? 1.0 : stats.charCompressionRatio());
            metadata.put(CAST_MERGED_NODES, stats.mergedNodes());
            metadata.put(CAST_PRESERVED_NODES, stats.preservedNodes());
            result.add(new CompressedChunk(chunk, compressed.compressedCode(), metadata));
        }
        log.debug("Compressed {} chunks", result.size());
        return result;
    }

    /**
     * Сводная статистика по результатам {@link #apply(List)}.
     */
    public static Map<String, Object> summarize(List<CompressedChunk> chunks) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_chunks", chunks.size());
        if (chunks.isEmpty()) {
            return summary;
        }

        int compressedChunks = 0;
        int mergedNodes = 0;
        int preservedNodes = 0;
        double charRatioSum = 0.0;
        for (CompressedChunk chunk : chunks) {
            if (!chunk.usesCast()) continue;
            compressedChunks++;
            charRatioSum += ((Number) chunk.metadata().get(CAST_CHAR_COMPRESSION_RATIO)).doubleValue();
            mergedNodes += ((Number) chunk.metadata().get(CAST_MERGED_NODES)).intValue();
            preservedNodes += ((Number) chunk.metadata().get(CAST_PRESERVED_NODES)).intValue();
        }

        summary.put("compressed_chunks", compressedChunks);
        summary.put("avg_char_compression_ratio", compressedChunks > 0 ? charRatioSum / compressedChunks : 1.0);
        summary.put("total_merged_nodes", mergedNodes);
        summary.put("total_preserved_nodes", preservedNodes);
        return summary;
    }
}
