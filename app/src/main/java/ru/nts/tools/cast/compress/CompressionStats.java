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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Статистика одного сжатия. Описательная: не влияет на решения о слиянии.
 *
 * @param totalNodes именованные узлы, посещённые при классификации
 * @param mergedNodes узлы, поглощённые слияниями (по 2 на слияние)
 * @param preservedNodes узлы сохраняемых типов
 * @param compressionRatio compressedTokens / originalTokens (0, если исходник пуст); может
 *                         превышать 1, так как псевдокод разделяет слитные токены ({@code a+b} даёт три)
 * @param charCompressionRatio compressedChars / originalChars (0, если исходник пуст)
 * @param originalTokens число токенов исходника (разбиение по пробельным символам Unicode)
 * @param compressedTokens число токенов псевдокода
 * @param originalChars длина исходника
 * @param compressedChars длина псевдокода
 * @param error причина работы в режиме passthrough или null
 */
public record CompressionStats(
        int totalNodes,
        int mergedNodes,
        int preservedNodes,
        double compressionRatio,
        double charCompressionRatio,
        int originalTokens,
        int compressedTokens,
        int originalChars,
        int compressedChars,
        String error
) {

    /** Непробельная последовательность; (?U) включает NBSP и прочие пробелы Unicode. */
    private static final Pattern TOKEN = Pattern.compile("(?U)\\S+");

    public static final String PARSER_NOT_AVAILABLE = "Parser not available";
    public static final String PARSE_FAILED = "Parse failed";

    /**
     * Статистика режима passthrough: содержит только причину.
     */
    public static CompressionStats degraded(String error) {
        return new CompressionStats(0, 0, 0, 1.0, 1.0, 0, 0, 0, 0, error);
    }

    static CompressionStats of(StatsAccumulator counters, String originalCode, String compressedCode) {
        int originalTokens = countTokens(originalCode);
        int compressedTokens = countTokens(compressedCode);
        int originalChars = originalCode.length();
        int compressedChars = compressedCode.length();

        double tokenRatio = originalTokens > 0 ? (double) compressedTokens / originalTokens : 0.0;
        double charRatio = originalChars > 0 ? (double) compressedChars / originalChars : 0.0;

        return new CompressionStats(counters.totalNodes(), counters.mergedNodes(), counters.preservedNodes(),
                tokenRatio, charRatio, originalTokens, compressedTokens, originalChars, compressedChars, null);
    }

    /**
     * Число токенов при разбиении по пробельным символам.
     */
    static int countTokens(String text) {
        if (text == null) return 0;
        Matcher matcher = TOKEN.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    public boolean isDegraded() {
        return error != null;
    }

    /**
     * Представление в виде карты с snake_case ключами.
     * Для режима passthrough карта содержит только "error".
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (isDegraded()) {
            map.put("error", error);
            return map;
        }
        map.put("total_nodes", totalNodes);
        map.put("merged_nodes", mergedNodes);
        map.put("preserved_nodes", preservedNodes);
        map.put("compression_ratio", compressionRatio);
        map.put("char_compression_ratio", charCompressionRatio);
        map.put("original_tokens", originalTokens);
        map.put("compressed_tokens", compressedTokens);
        map.put("original_chars", originalChars);
        map.put("compressed_chars", compressedChars);
        return map;
    }
}
