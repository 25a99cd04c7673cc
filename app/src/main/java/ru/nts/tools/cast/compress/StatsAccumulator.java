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
 * Счётчики одного вызова compress(). Создаётся на каждый вызов, не разделяется между потоками.
 */
final class StatsAccumulator {

    private int totalNodes;
    private int mergedNodes;
    private int preservedNodes;

    void countNode() {
        totalNodes++;
    }

    void countPreserved() {
        preservedNodes++;
    }

    void countMerged(int absorbed) {
        mergedNodes += absorbed;
    }

    int totalNodes() {
        return totalNodes;
    }

    int mergedNodes() {
        return mergedNodes;
    }

    int preservedNodes() {
        return preservedNodes;
    }
}
