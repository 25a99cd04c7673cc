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
package ru.nts.tools.cast.core.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.cast.core.CastErrorCode;
import ru.nts.tools.cast.core.CastException;
import ru.nts.tools.cast.core.treesitter.LanguageDetector;
import ru.nts.tools.cast.core.treesitter.TreeSitterSourceParser;

import java.util.Map;
import java.util.Optional;

/**
 * Фабрика парсеров с проверкой доступности.
 * Нативная библиотека tree-sitter может отсутствовать на платформе: в этом случае
 * возвращается empty и компрессор работает в режиме passthrough.
 */
public final class SourceParsers {

    private static final Logger log = LoggerFactory.getLogger(SourceParsers.class);

    private SourceParsers() {}

    /**
     * Создаёт парсер для языка и проверяет его пробным разбором.
     * Ошибка логируется один раз здесь и не повторяется при каждом вызове compress().
     *
     * @param langId идентификатор языка
     * @return парсер или empty, если грамматика/нативная библиотека недоступна
     */
    public static Optional<SourceParser> forLanguage(String langId) {
        if (!LanguageDetector.isSupported(langId)) {
            CastException e = new CastException(CastErrorCode.LANGUAGE_UNSUPPORTED, "language", String.valueOf(langId));
            log.warn("{}; cAST compression will be disabled", e.toLogMessage());
            return Optional.empty();
        }
        try {
            SourceParser parser = new TreeSitterSourceParser(langId);
            parser.parse("");
            return Optional.of(parser);
        } catch (LinkageError | RuntimeException e) {
            CastException error = new CastException(CastErrorCode.PARSER_UNAVAILABLE,
                    Map.of("language", langId), e);
            log.warn("{}; cAST compression will be disabled", error.toLogMessage(), e);
            return Optional.empty();
        }
    }
}
