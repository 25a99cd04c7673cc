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

import ru.nts.tools.cast.core.CastErrorCode;
import ru.nts.tools.cast.core.CastException;

import java.util.Map;

/**
 * Настройки компрессора. Создаётся один раз вызывающим кодом и передаётся в
 * {@link CastCompressor}; неизменяемый.
 *
 * <p>Переменные окружения (см. {@link #builderFromEnvironment(Map)}; CLI передаёт
 * сюда окружение процесса):
 * <ul>
 *   <li>USE_CAST - включает сжатие чанков в пакетной обработке (по умолчанию false)</li>
 *   <li>CAST_SIMILARITY_THRESHOLD - порог сходства (по умолчанию 0.7)</li>
 *   <li>CAST_MAX_COMPRESSION_RATIO - максимальная доля поглощённых узлов (по умолчанию 0.6)</li>
 * </ul>
 */
public final class CompressionConfig {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.7;
    public static final double DEFAULT_MAX_COMPRESSION_RATIO = 0.6;
    public static final String DEFAULT_LANGUAGE = "java";

    public static final String ENV_USE_CAST = "USE_CAST";
    public static final String ENV_SIMILARITY_THRESHOLD = "CAST_SIMILARITY_THRESHOLD";
    public static final String ENV_MAX_COMPRESSION_RATIO = "CAST_MAX_COMPRESSION_RATIO";

    private final double similarityThreshold;
    private final double maxCompressionRatio;
    private final boolean enabled;
    private final String languageId;
    private final NodeKindVocabulary vocabulary;

    private CompressionConfig(Builder builder) {
        this.similarityThreshold = requireUnitInterval("similarityThreshold", builder.similarityThreshold);
        this.maxCompressionRatio = requireUnitInterval("maxCompressionRatio", builder.maxCompressionRatio);
        this.enabled = builder.enabled;
        this.languageId = builder.languageId;
        this.vocabulary = builder.vocabulary;
    }

    public static CompressionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Читает настройки из карты в стиле переменных окружения.
     *
     * @throws CastException CONFIG_INVALID, если число не разбирается или вне (0, 1]
     */
    public static CompressionConfig fromEnvironment(Map<String, String> env) {
        return builderFromEnvironment(env).build();
    }

    /**
     * Построитель, заполненный из переменных окружения; вызывающий код может
     * переопределить отдельные значения (например, флагами командной строки).
     *
     * @throws CastException CONFIG_INVALID, если число не разбирается или вне (0, 1]
     */
    public static Builder builderFromEnvironment(Map<String, String> env) {
        Builder builder = builder()
                .enabled("true".equalsIgnoreCase(env.getOrDefault(ENV_USE_CAST, "false").trim()));

        String threshold = env.get(ENV_SIMILARITY_THRESHOLD);
        if (threshold != null && !threshold.isBlank()) {
            builder.similarityThreshold(parseRatio(ENV_SIMILARITY_THRESHOLD, threshold));
        }
        String maxRatio = env.get(ENV_MAX_COMPRESSION_RATIO);
        if (maxRatio != null && !maxRatio.isBlank()) {
            builder.maxCompressionRatio(parseRatio(ENV_MAX_COMPRESSION_RATIO, maxRatio));
        }
        return builder;
    }

    static double parseRatio(String key, String raw) {
        try {
            return requireUnitInterval(key, Double.parseDouble(raw.trim()));
        } catch (NumberFormatException e) {
            throw new CastException(CastErrorCode.CONFIG_INVALID, Map.of("key", key, "value", raw), e);
        }
    }

    private static double requireUnitInterval(String key, double value) {
        if (Double.isNaN(value) || value <= 0.0 || value > 1.0) {
            throw new CastException(CastErrorCode.CONFIG_INVALID, Map.of("key", key, "value", value));
        }
        return value;
    }

    public double similarityThreshold() {
        return similarityThreshold;
    }

    public double maxCompressionRatio() {
        return maxCompressionRatio;
    }

    /**
     * Применять ли сжатие в пакетной обработке чанков.
     * Сам {@link CastCompressor#compress(String)} этот флаг не проверяет.
     */
    public boolean enabled() {
        return enabled;
    }

    public String languageId() {
        return languageId;
    }

    public NodeKindVocabulary vocabulary() {
        return vocabulary;
    }

    @Override
    public String toString() {
        return "CompressionConfig{threshold=" + similarityThreshold
                + ", maxRatio=" + maxCompressionRatio
                + ", enabled=" + enabled
                + ", language=" + languageId + "}";
    }

    public static final class Builder {
        private double similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;
        private double maxCompressionRatio = DEFAULT_MAX_COMPRESSION_RATIO;
        private boolean enabled = true;
        private String languageId = DEFAULT_LANGUAGE;
        private NodeKindVocabulary vocabulary = NodeKindVocabulary.java();

        private Builder() {}

        public Builder similarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder maxCompressionRatio(double maxCompressionRatio) {
            this.maxCompressionRatio = maxCompressionRatio;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder languageId(String languageId) {
            this.languageId = languageId;
            return this;
        }

        public Builder vocabulary(NodeKindVocabulary vocabulary) {
            this.vocabulary = vocabulary;
            return this;
        }

        public CompressionConfig build() {
            return new CompressionConfig(this);
        }
    }
}
