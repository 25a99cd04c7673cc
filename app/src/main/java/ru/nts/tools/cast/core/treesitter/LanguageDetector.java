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

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Определяет язык исходного кода по расширению файла.
 * Словарь типов узлов для сжатия задаётся отдельно для каждого языка,
 * поэтому здесь перечислены только языки со словарём и грамматикой.
 */
public final class LanguageDetector {

    private LanguageDetector() {}

    private static final Map<String, String> EXTENSION_MAP = Map.of(
            "java", "java"
    );

    private static final List<String> SUPPORTED_LANGUAGES = List.of("java");

    /**
     * Определяет язык по пути к файлу.
     *
     * @param path путь к файлу
     * @return идентификатор языка или empty если язык не поддерживается
     */
    public static Optional<String> detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }

        String fileName = path.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');

        if (dotIndex < 0 || dotIndex == fileName.length() - 1) {
            return Optional.empty();
        }

        String extension = fileName.substring(dotIndex + 1).toLowerCase();
        return Optional.ofNullable(EXTENSION_MAP.get(extension));
    }

    /**
     * Проверяет, поддерживается ли указанный язык.
     */
    public static boolean isSupported(String langId) {
        return langId != null && SUPPORTED_LANGUAGES.contains(langId.toLowerCase());
    }

    public static List<String> getSupportedLanguages() {
        return SUPPORTED_LANGUAGES;
    }
}
