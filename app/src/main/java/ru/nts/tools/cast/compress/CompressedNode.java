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

import java.util.List;

/**
 * Узел сжатого дерева.
 * Строится заново при каждом вызове compress() и содержит всё необходимое для
 * рендеринга без обращения к исходному дереву. Отсутствующий текст - пустая строка.
 */
public sealed interface CompressedNode
        permits CompressedNode.Leaf, CompressedNode.Preserved, CompressedNode.Regular, CompressedNode.Merged {

    String kind();

    NodeCategory category();

    /**
     * Собственный текст узла (пустая строка, если его нет).
     */
    String text();

    List<CompressedNode> children();

    default boolean isLeaf() {
        return this instanceof Leaf;
    }

    /**
     * Терминальный узел с точным текстом из исходника.
     */
    record Leaf(String kind, NodeCategory category, String text) implements CompressedNode {
        public Leaf {
            text = text != null ? text : "";
        }

        @Override
        public List<CompressedNode> children() {
            return List.of();
        }
    }

    /**
     * Узел из множества сохраняемых типов. Дети сжимаются рекурсивно,
     * сам узел никогда не сливается с соседями.
     *
     * @param text текст узла, только если у него нет детей
     */
    record Preserved(String kind, NodeCategory category, List<CompressedNode> children, String text)
            implements CompressedNode {
        public Preserved {
            children = List.copyOf(children);
            text = text != null ? text : "";
        }
    }

    /**
     * Любой другой составной узел.
     */
    record Regular(String kind, NodeCategory category, List<CompressedNode> children) implements CompressedNode {
        public Regular {
            children = List.copyOf(children);
        }

        @Override
        public String text() {
            return "";
        }
    }

    /**
     * Результат слияния двух соседних узлов.
     *
     * @param originalCount сколько исходных узлов поглощено (всегда 2 за одно слияние)
     * @param children дети левого операнда, затем дети правого
     * @param text объединённый через пробел текст операндов
     */
    record Merged(String kind, NodeCategory category, int originalCount, List<CompressedNode> children, String text)
            implements CompressedNode {
        public Merged {
            if (originalCount < 2) {
                throw new IllegalArgumentException("Merged node must absorb at least 2 nodes, got " + originalCount);
            }
            children = List.copyOf(children);
            text = text != null ? text : "";
        }
    }
}
