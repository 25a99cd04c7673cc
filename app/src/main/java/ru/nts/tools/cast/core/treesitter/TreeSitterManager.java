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
package ru.nts.tools.cast.core.treesitter;

import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJava;
import ru.nts.tools.cast.core.CastErrorCode;
import ru.nts.tools.cast.core.CastException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Менеджер tree-sitter парсеров.
 * Хранит TSLanguage объекты и пул парсеров по языкам.
 * Thread-safe через ThreadLocal парсеров: деревья не кэшируются,
 * каждое сжатие разбирает свой фрагмент заново.
 */
public final class TreeSitterManager {

    private static final TreeSitterManager INSTANCE = new TreeSitterManager();

    /**
     * Кэшированные TSLanguage объекты (потокобезопасные, можно переиспользовать).
     */
    private final Map<String, TSLanguage> languages = new ConcurrentHashMap<>();

    /**
     * ThreadLocal парсеры для каждого языка (TSParser не thread-safe).
     */
    private final Map<String, ThreadLocal<TSParser>> parsers = new ConcurrentHashMap<>();

    private TreeSitterManager() {}

    public static TreeSitterManager getInstance() {
        return INSTANCE;
    }

    /**
     * Получает TSLanguage объект для указанного языка.
     * Ленивая загрузка - язык загружается только при первом обращении.
     *
     * @param langId идентификатор языка
     * @return TSLanguage объект
     * @throws CastException если язык не поддерживается
     */
    public TSLanguage getLanguage(String langId) {
        return languages.computeIfAbsent(langId, this::loadLanguage);
    }

    private TSLanguage loadLanguage(String langId) {
        return switch (langId) {
            case "java" -> new TreeSitterJava();
            default -> throw new CastException(CastErrorCode.LANGUAGE_UNSUPPORTED, "language", langId);
        };
    }

    /**
     * Получает или создает TSParser для текущего потока.
     */
    private TSParser getParser(String langId) {
        ThreadLocal<TSParser> parserHolder = parsers.computeIfAbsent(langId,
                k -> ThreadLocal.withInitial(() -> {
                    TSParser parser = new TSParser();
                    parser.setLanguage(getLanguage(k));
                    return parser;
                }));
        return parserHolder.get();
    }

    /**
     * Парсит строку содержимого и возвращает AST дерево.
     * tree-sitter устойчив к ошибкам: некорректный код даёт дерево с ERROR узлами.
     *
     * @param content исходный код
     * @param langId идентификатор языка
     * @return AST дерево
     * @throws CastException если язык не поддерживается
     * @throws IllegalStateException если парсер не вернул дерево
     */
    public TSTree parse(String content, String langId) {
        TSParser parser = getParser(langId);
        TSTree tree = parser.parseString(null, content);
        if (tree == null) {
            throw new IllegalStateException("Failed to parse content for language: " + langId);
        }
        return tree;
    }
}
