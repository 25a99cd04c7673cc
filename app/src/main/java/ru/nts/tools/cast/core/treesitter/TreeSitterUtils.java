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

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;

/**
 * Утилиты для работы с узлами tree-sitter.
 */
public final class TreeSitterUtils {

    private TreeSitterUtils() {}

    /**
     * Находит первый дочерний узел указанного типа.
     */
    public static TSNode findChildByType(TSNode parent, String type) {
        int childCount = parent.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = parent.getChild(i);
            if (child != null && !child.isNull() && child.getType().equals(type)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Извлекает текст узла из байтового массива (корректно для UTF-8).
     * КРИТИЧНО: tree-sitter возвращает байтовые смещения, а не символьные!
     */
    public static String getNodeTextFromBytes(TSNode node, byte[] contentBytes) {
        int start = node.getStartByte();
        int end = node.getEndByte();
        if (start >= 0 && end <= contentBytes.length && start < end) {
            return new String(contentBytes, start, end - start, StandardCharsets.UTF_8);
        }
        return "";
    }

    /**
     * Номер первой строки узла (1-based).
     */
    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /**
     * Номер последней строки узла (1-based).
     */
    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    /**
     * Извлекает сигнатуру метода: текст до тела или до ';', с нормализованными пробелами.
     */
    public static String extractMethodSignature(String declarationText) {
        int braceIdx = declarationText.indexOf('{');
        int semiIdx = declarationText.indexOf(';');

        int endIdx = declarationText.length();
        if (braceIdx > 0) endIdx = braceIdx;
        if (semiIdx > 0 && semiIdx < endIdx) endIdx = semiIdx;

        String signature = declarationText.substring(0, endIdx).trim();
        return signature.replaceAll("\\s+", " ");
    }
}
