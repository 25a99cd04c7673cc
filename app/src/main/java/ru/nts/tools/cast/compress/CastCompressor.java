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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.cast.core.tree.SourceNode;
import ru.nts.tools.cast.core.tree.SourceParser;
import ru.nts.tools.cast.core.tree.SourceParsers;

/**
 * Компрессор cAST (Compressed AST): жадное слияние похожих соседних инструкций.
 *
 * <p>Конвейер одного вызова: разбор, классификация со слиянием (рекурсивно, снизу вверх),
 * рендеринг псевдокода, снимок статистики. Состояние между вызовами не хранится,
 * поэтому экземпляр можно использовать из нескольких потоков.
 *
 * <p>Если псевдокод со слияниями длиннее исходника (или пуст при непустом исходнике),
 * используется псевдокод без слияний, а если не подходит и он - исходный текст.
 * Статистика всегда описывает возвращённый текст: при откате merged_nodes равен 0.
 *
 * <p>Если парсер недоступен, {@link #compress(String)} возвращает исходный текст,
 * коэффициент 1.0 и статистику с ошибкой "Parser not available". Исключения наружу не выходят.
 */
public final class CastCompressor {

    private static final Logger log = LoggerFactory.getLogger(CastCompressor.class);

    private final CompressionConfig config;
    private final SourceParser parser;
    private final SimilarityMetric metric = new SimilarityMetric();

    /**
     * @param config настройки
     * @param parser парсер или null, если возможность разбора недоступна
     */
    public CastCompressor(CompressionConfig config, SourceParser parser) {
        this.config = config;
        this.parser = parser;
    }

    /**
     * Создаёт компрессор с tree-sitter парсером для языка из настроек.
     * Недоступность парсера логируется один раз здесь.
     */
    public static CastCompressor create(CompressionConfig config) {
        return new CastCompressor(config, SourceParsers.forLanguage(config.languageId()).orElse(null));
    }

    public static CastCompressor create() {
        return create(CompressionConfig.defaults());
    }

    public boolean isParserAvailable() {
        return parser != null;
    }

    public CompressionConfig config() {
        return config;
    }

    /**
     * Сжимает исходный код.
     *
     * @param sourceCode исходный код (null считается пустой строкой)
     * @return результат; в режиме passthrough compressedCode == originalCode
     */
    public CompressionResult compress(String sourceCode) {
        String code = sourceCode != null ? sourceCode : "";
        if (parser == null) {
            return CompressionResult.passthrough(code, CompressionStats.PARSER_NOT_AVAILABLE);
        }

        SourceNode root;
        try {
            root = parser.parse(code);
        } catch (RuntimeException e) {
            log.debug("Parse failed, returning source unchanged: {}", e.getMessage());
            return CompressionResult.passthrough(code, CompressionStats.PARSE_FAILED);
        }
        return compressTree(root, code);
    }

    /**
     * Сжимает уже разобранное дерево.
     *
     * @param root корень дерева
     * @param originalCode текст, из которого построено дерево (для статистики)
     */
    public CompressionResult compressTree(SourceNode root, String originalCode) {
        String code = originalCode != null ? originalCode : "";
        PseudoCodeRenderer renderer = new PseudoCodeRenderer(config.vocabulary());
        StatsAccumulator counters = new StatsAccumulator();
        String compressedCode = renderer.render(newClassifier().classify(root, counters));

        if (!fitsSource(compressedCode, code)) {
            // Аннотации слияния длиннее коротких инструкций: пробуем псевдокод без слияний
            log.debug("Merged pseudo-code ({} chars) rejected for source of {} chars",
                    compressedCode.length(), code.length());
            counters = new StatsAccumulator();
            compressedCode = renderer.render(new TreeClassifier(config.vocabulary(), null).classify(root, counters));
            if (!fitsSource(compressedCode, code)) {
                compressedCode = code;
            }
        }

        CompressionStats stats = CompressionStats.of(counters, code, compressedCode);
        if (log.isDebugEnabled()) {
            log.debug("cAST: nodes={}, merged={}, preserved={}, tokens {} -> {}",
                    stats.totalNodes(), stats.mergedNodes(), stats.preservedNodes(),
                    stats.originalTokens(), stats.compressedTokens());
        }
        return new CompressionResult(compressedCode, code, stats.compressionRatio(), stats);
    }

    /**
     * Строит сжатое дерево без рендеринга.
     */
    public CompressedNode compressToTree(SourceNode root) {
        return newClassifier().classify(root, new StatsAccumulator());
    }

    /**
     * Сжимает фрагмент метода и возвращает только псевдокод (для эмбеддингов).
     */
    public String compressMethodChunk(String methodCode) {
        return compress(methodCode).compressedCode();
    }

    /**
     * Псевдокод не длиннее исходника и не пуст для непустого исходника.
     */
    private static boolean fitsSource(String pseudoCode, String source) {
        return pseudoCode.length() <= source.length() && !(pseudoCode.isBlank() && !source.isBlank());
    }

    private TreeClassifier newClassifier() {
        SiblingMerger merger = new SiblingMerger(metric, config.similarityThreshold(), config.maxCompressionRatio());
        return new TreeClassifier(config.vocabulary(), merger);
    }
}
