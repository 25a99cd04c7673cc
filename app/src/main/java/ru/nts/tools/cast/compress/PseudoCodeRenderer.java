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

/**
 * Превращает сжатое дерево в плоский псевдокод для эмбеддингов.
 *
 * <p>Листья выводятся как текст с пробелом (чистый синтаксис пропускается),
 * сохранённые и обычные узлы - как конкатенация детей, слитые узлы - как
 * комментарий-аннотация с числом поглощённых узлов, типом и усечённым текстом.
 */
final class PseudoCodeRenderer {

    static final int MAX_MERGED_TEXT = 50;
    private static final String ELLIPSIS = "...";

    private final NodeKindVocabulary vocabulary;

    PseudoCodeRenderer(NodeKindVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    String render(CompressedNode root) {
        StringBuilder sb = new StringBuilder();
        render(root, sb);
        return sb.toString();
    }

    private void render(CompressedNode node, StringBuilder out) {
        if (node instanceof CompressedNode.Leaf leaf) {
            appendToken(leaf.text(), out);
        } else if (node instanceof CompressedNode.Preserved preserved) {
            if (preserved.children().isEmpty()) {
                appendToken(preserved.text(), out);
            } else {
                renderChildren(preserved, out);
            }
        } else if (node instanceof CompressedNode.Merged merged) {
            renderMerged(merged, out);
        } else {
            renderChildren(node, out);
        }
    }

    private void renderChildren(CompressedNode node, StringBuilder out) {
        for (CompressedNode child : node.children()) {
            render(child, out);
        }
    }

    private void renderMerged(CompressedNode.Merged merged, StringBuilder out) {
        String text = merged.text();
        if (!text.isEmpty()) {
            out.append("/* ").append(merged.originalCount()).append("x ").append(merged.kind())
                    .append(": ").append(truncate(text)).append(" */ ");
            return;
        }
        if (!merged.children().isEmpty()) {
            renderChildren(merged, out);
            return;
        }
        out.append("/* ").append(merged.originalCount()).append("x ").append(merged.kind()).append(" */ ");
    }

    private void appendToken(String text, StringBuilder out) {
        String trimmed = text.strip();
        if (trimmed.isEmpty() || vocabulary.isSyntaxToken(trimmed)) {
            return;
        }
        out.append(trimmed).append(' ');
    }

    /**
     * Усечение по кодовым точкам: суррогатная пара никогда не разрезается.
     */
    static String truncate(String text) {
        if (text.codePointCount(0, text.length()) > MAX_MERGED_TEXT) {
            int end = text.offsetByCodePoints(0, MAX_MERGED_TEXT - ELLIPSIS.length());
            return text.substring(0, end) + ELLIPSIS;
        }
        return text;
    }
}
