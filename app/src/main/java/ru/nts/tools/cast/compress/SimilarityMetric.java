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
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Детерминированная мера сходства двух узлов в диапазоне [0.0, 1.0].
 *
 * <p>Взвешенная сумма трёх факторов:
 * <ul>
 *   <li>совпадение типа (0.4; 0.3 для разных типов одного управляющего семейства)</li>
 *   <li>структура: близость числа детей (0.3)</li>
 *   <li>пересечение токенов текста по Жаккару (0.3)</li>
 * </ul>
 * Повторяющиеся вызовы сеттеров с разными аргументами сливаются, а if и for - никогда.
 */
public final class SimilarityMetric {

    static final double KIND_WEIGHT = 0.4;
    static final double FAMILY_WEIGHT = 0.3;
    static final double STRUCTURE_WEIGHT = 0.3;
    static final double ASYMMETRY_SCORE = 0.1;
    static final double TEXT_WEIGHT = 0.3;
    static final double JACCARD_CUTOFF = 0.3;
    static final double TEXT_FLOOR = 0.1;
    private static final Pattern TOKEN = Pattern.compile("(?U)\\S+");


    public double score(CompressedNode first, CompressedNode second) {
        double score = kindScore(first, second)
                + structureScore(first.children().size(), second.children().size())
                + textScore(extractText(first), extractText(second));
        return Math.min(score, 1.0);
    }

    double kindScore(CompressedNode first, CompressedNode second) {
        if (first.kind().equals(second.kind())) {
            return KIND_WEIGHT;
        }
        NodeCategory category = first.category();
        if (category == second.category() && category.isControlFlowFamily()) {
            return FAMILY_WEIGHT;
        }
        return 0.0;
    }

    double structureScore(int firstChildren, int secondChildren) {
        if (firstChildren > 0 && secondChildren > 0) {
            double sizeSimilarity = 1.0 - (double) Math.abs(firstChildren - secondChildren)
                    / Math.max(firstChildren, secondChildren);
            return STRUCTURE_WEIGHT * sizeSimilarity;
        }
        if (firstChildren == 0 && secondChildren == 0) {
            return STRUCTURE_WEIGHT;
        }
        return ASYMMETRY_SCORE;
    }

    double textScore(String firstText, String secondText) {
        if (firstText.isEmpty() || secondText.isEmpty()) {
            return 0.0;
        }
        Set<String> firstTokens = tokenize(firstText);
        Set<String> secondTokens = tokenize(secondText);
        if (firstTokens.isEmpty() || secondTokens.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(firstTokens);
        intersection.retainAll(secondTokens);
        Set<String> union = new HashSet<>(firstTokens);
        union.addAll(secondTokens);
        double jaccard = (double) intersection.size() / union.size();

        if (jaccard > JACCARD_CUTOFF) {
            return TEXT_WEIGHT * jaccard;
        }
        return TEXT_FLOOR;
    }

    private static Set<String> tokenize(String text) {
        Set<String> tokens = new HashSet<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * Текст узла: собственный, а если его нет - тексты потомков через пробел.
     */
    public static String extractText(CompressedNode node) {
        if (!node.text().isEmpty()) {
            return node.text();
        }
        if (node.children().isEmpty()) {
            return "";
        }
        List<String> texts = new ArrayList<>();
        for (CompressedNode child : node.children()) {
            String childText = extractText(child);
            if (!childText.isEmpty()) {
                texts.add(childText);
            }
        }
        return String.join(" ", texts);
    }
}
