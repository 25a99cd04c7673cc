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

import java.util.List;

/**
 * Узел синтаксического дерева, построенного внешним парсером.
 * Только для чтения: компрессор никогда не изменяет входное дерево.
 */
public interface SourceNode {

    /**
     * Тип узла в словаре грамматики (например "if_statement", "block", ";").
     */
    String kind();

    /**
     * Именованный узел несёт смысл; анонимные узлы - это чистый синтаксис (скобки, ключевые слова).
     */
    boolean isNamed();

    /**
     * Дочерние узлы в порядке следования в исходном тексте.
     */
    List<SourceNode> children();

    /**
     * Точный текст узла из исходника.
     */
    String text();

    int startByte();

    int endByte();

    /**
     * Строка начала узла (1-based).
     */
    int startLine();

    /**
     * Строка конца узла (1-based).
     */
    int endLine();

    default boolean isLeaf() {
        return children().isEmpty();
    }
}
