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

import java.util.ArrayList;
import java.util.List;

/**
 * Жадное слияние похожих соседних инструкций внутри контейнера.
 *
 * <p>Один проход слева направо: кандидат (составной узел сливаемого типа) сравнивается
 * с ближайшим следующим кандидатом. При сходстве не ниже порога пара заменяется одним
 * {@link CompressedNode.Merged} на месте левого операнда. Результат слияния в этом
 * проходе больше не рассматривается. Листья (скобки, комментарии) между кандидатами
 * не разрывают пару, любой другой составной узел - разрывает.
 */
final class SiblingMerger {

    private final SimilarityMetric metric;
    private final double similarityThreshold;
    private final double maxCompressionRatio;

    SiblingMerger(SimilarityMetric metric, double similarityThreshold, double maxCompressionRatio) {
        this.metric = metric;
        this.similarityThreshold = similarityThreshold;
        this.maxCompressionRatio = maxCompressionRatio;
    }

    /**
     * Сливает похожих соседей.
     *
     * @param siblings уже сжатые дети контейнера
     * @param vocabulary словарь типов
     * @param stats счётчики текущего вызова
     * @return новый список или исходный, если слияние не уменьшило число узлов
     */
    List<CompressedNode> merge(List<CompressedNode> siblings, NodeKindVocabulary vocabulary, StatsAccumulator stats) {
        if (siblings.size() <= 1 || countCandidates(siblings, vocabulary) < 2) {
            return siblings;
        }

        List<CompressedNode> result = new ArrayList<>(siblings.size());
        int pendingIndex = -1;
        int absorbed = 0;

        for (CompressedNode sibling : siblings) {
            if (!isCandidate(sibling, vocabulary)) {
                result.add(sibling);
                if (!sibling.isLeaf()) {
                    pendingIndex = -1;
                }
                continue;
            }

            if (pendingIndex >= 0
                    && withinRatioCap(stats, absorbed + 2)
                    && metric.score(result.get(pendingIndex), sibling) >= similarityThreshold) {
                result.set(pendingIndex, mergeNodes(result.get(pendingIndex), sibling));
                absorbed += 2;
                // Merged терминален для этого прохода
                pendingIndex = -1;
            } else {
                result.add(sibling);
                pendingIndex = result.size() - 1;
            }
        }

        if (result.size() >= siblings.size()) {
            return siblings;
        }
        stats.countMerged(absorbed);
        return result;
    }

    private boolean isCandidate(CompressedNode node, NodeKindVocabulary vocabulary) {
        return !node.isLeaf() && !(node instanceof CompressedNode.Merged) && vocabulary.isMergeable(node.kind());
    }

    private int countCandidates(List<CompressedNode> siblings, NodeKindVocabulary vocabulary) {
        int count = 0;
        for (CompressedNode sibling : siblings) {
            if (isCandidate(sibling, vocabulary)) count++;
        }
        return count;
    }

    /**
     * Доля поглощённых узлов не должна превышать maxCompressionRatio.
     */
    private boolean withinRatioCap(StatsAccumulator stats, int absorbedAfterMerge) {
        int total = stats.totalNodes();
        if (total <= 0) {
            return false;
        }
        return (double) (stats.mergedNodes() + absorbedAfterMerge) / total <= maxCompressionRatio;
    }

    /**
     * Объединяет два узла: тип левого, дети левого затем правого, тексты через пробел.
     */
    static CompressedNode.Merged mergeNodes(CompressedNode left, CompressedNode right) {
        List<CompressedNode> children = new ArrayList<>(left.children().size() + right.children().size());
        children.addAll(left.children());
        children.addAll(right.children());

        String leftText = SimilarityMetric.extractText(left);
        String rightText = SimilarityMetric.extractText(right);
        String text;
        if (!leftText.isEmpty() && !rightText.isEmpty()) {
            text = leftText + " " + rightText;
        } else if (!leftText.isEmpty()) {
            text = leftText;
        } else {
            text = rightText;
        }

        return new CompressedNode.Merged(left.kind(), left.category(), 2, children, text);
    }
}
