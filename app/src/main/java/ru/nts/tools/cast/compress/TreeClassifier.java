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

import ru.nts.tools.cast.core.tree.SourceNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Рекурсивно превращает исходное дерево в сжатое.
 * Каждый узел классифицируется по словарю, дети сжимаются снизу вверх,
 * а среди детей контейнеров инструкций выполняется слияние соседей.
 */
final class TreeClassifier {

    private final NodeKindVocabulary vocabulary;
    private final SiblingMerger merger;

    /**
     * @param merger слияние соседей или null, чтобы только классифицировать
     */
    TreeClassifier(NodeKindVocabulary vocabulary, SiblingMerger merger) {
        this.vocabulary = vocabulary;
        this.merger = merger;
    }

    /**
     * Решение для узла без учёта его детей.
     */
    NodeTreatment treatmentOf(SourceNode node) {
        String kind = node.kind();
        if (vocabulary.isPreserved(kind)) {
            return NodeTreatment.PRESERVE;
        }
        if (node.isLeaf()) {
            return NodeTreatment.LEAF;
        }
        if (vocabulary.isMergeable(kind)) {
            return NodeTreatment.MERGEABLE;
        }
        return NodeTreatment.REGULAR;
    }

    CompressedNode classify(SourceNode node, StatsAccumulator stats) {
        if (node.isNamed()) {
            stats.countNode();
        }

        String kind = node.kind();
        NodeCategory category = vocabulary.categoryOf(kind);

        switch (treatmentOf(node)) {
            case PRESERVE -> {
                stats.countPreserved();
                List<CompressedNode> children = compressChildren(node, stats);
                String text = children.isEmpty() ? node.text() : "";
                return new CompressedNode.Preserved(kind, category, children, text);
            }
            case LEAF -> {
                return new CompressedNode.Leaf(kind, category, node.text());
            }
            default -> {
                return new CompressedNode.Regular(kind, category, compressChildren(node, stats));
            }
        }
    }

    private List<CompressedNode> compressChildren(SourceNode node, StatsAccumulator stats) {
        List<CompressedNode> children = new ArrayList<>(node.children().size());
        for (SourceNode child : node.children()) {
            children.add(classify(child, stats));
        }
        if (merger != null && vocabulary.isBlockContainer(node.kind())) {
            return merger.merge(children, vocabulary, stats);
        }
        return children;
    }
}
