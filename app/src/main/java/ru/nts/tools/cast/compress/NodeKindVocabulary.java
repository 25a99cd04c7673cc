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

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Словарь типов узлов для одного языка.
 * Определяет, какие узлы сохраняются, какие можно сливать, какие являются
 * контейнерами инструкций и какие токены считаются чистым синтаксисом.
 * Неизменяемый, безопасен для совместного использования.
 */
public final class NodeKindVocabulary {

    /**
     * Токены, которые не несут смысла и пропускаются при генерации псевдокода.
     */
    public static final Set<String> DEFAULT_SYNTAX_TOKENS = Set.of(
            "(", ")", "{", "}", "[", "]", ";", ",", ".", "<", ">"
    );

    private static final NodeKindVocabulary JAVA = builder()
            // Control flow
            .preserve(NodeCategory.CONDITIONAL, "if_statement", "switch_statement", "switch_expression",
                    "switch_block_statement_group")
            .preserve(NodeCategory.LOOP, "for_statement", "enhanced_for_statement", "while_statement",
                    "do_statement")
            .preserve(NodeCategory.EXCEPTION_HANDLING, "try_statement", "try_with_resources_statement",
                    "catch_clause", "finally_clause", "throw_statement")
            // Declarations
            .preserve(NodeCategory.DECLARATION, "method_declaration", "class_declaration",
                    "interface_declaration", "constructor_declaration", "field_declaration",
                    "record_declaration", "enum_declaration")
            // Critical statements
            .preserve(NodeCategory.EXPRESSION, "assignment_expression")
            .preserve(NodeCategory.OTHER, "return_statement")
            // Structural
            .preserve(NodeCategory.OTHER, "block", "constructor_body")
            .mergeable(NodeCategory.EXPRESSION, "expression_statement", "method_invocation",
                    "binary_expression", "unary_expression", "field_access", "array_access")
            .mergeable(NodeCategory.DECLARATION, "local_variable_declaration")
            .mergeable(NodeCategory.OTHER, "argument_list")
            .blockContainers("block", "constructor_body", "switch_block_statement_group")
            .category(NodeCategory.CONDITIONAL, "ternary_expression")
            .build();

    private final Set<String> preserveKinds;
    private final Set<String> mergeableKinds;
    private final Set<String> blockContainerKinds;
    private final Set<String> syntaxTokens;
    private final Map<String, NodeCategory> categories;

    private NodeKindVocabulary(Builder builder) {
        this.preserveKinds = Set.copyOf(builder.preserveKinds);
        this.mergeableKinds = Set.copyOf(builder.mergeableKinds);
        this.blockContainerKinds = Set.copyOf(builder.blockContainerKinds);
        this.syntaxTokens = Set.copyOf(builder.syntaxTokens);
        this.categories = Map.copyOf(builder.categories);
    }

    /**
     * Словарь для грамматики tree-sitter-java.
     */
    public static NodeKindVocabulary java() {
        return JAVA;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPreserved(String kind) {
        return preserveKinds.contains(kind);
    }

    public boolean isMergeable(String kind) {
        return mergeableKinds.contains(kind);
    }

    /**
     * Контейнер инструкций: среди его непосредственных детей выполняется слияние.
     */
    public boolean isBlockContainer(String kind) {
        return blockContainerKinds.contains(kind);
    }

    public boolean isSyntaxToken(String text) {
        return syntaxTokens.contains(text);
    }

    /**
     * Семейство конструкции для типа узла; неизвестные типы (включая ERROR) - OTHER.
     */
    public NodeCategory categoryOf(String kind) {
        return categories.getOrDefault(kind, NodeCategory.OTHER);
    }

    public Set<String> preserveKinds() {
        return preserveKinds;
    }

    public Set<String> mergeableKinds() {
        return mergeableKinds;
    }

    /**
     * Построитель словаря. Тип не может одновременно сохраняться и сливаться.
     */
    public static final class Builder {
        private final Set<String> preserveKinds = new HashSet<>();
        private final Set<String> mergeableKinds = new HashSet<>();
        private final Set<String> blockContainerKinds = new HashSet<>();
        private final Set<String> syntaxTokens = new HashSet<>(DEFAULT_SYNTAX_TOKENS);
        private final Map<String, NodeCategory> categories = new HashMap<>();

        private Builder() {}

        public Builder preserve(NodeCategory category, String... kinds) {
            for (String kind : kinds) {
                preserveKinds.add(kind);
                categories.put(kind, category);
            }
            return this;
        }

        public Builder mergeable(NodeCategory category, String... kinds) {
            for (String kind : kinds) {
                mergeableKinds.add(kind);
                categories.put(kind, category);
            }
            return this;
        }

        public Builder blockContainers(String... kinds) {
            blockContainerKinds.addAll(Set.of(kinds));
            return this;
        }

        /**
         * Категория для типа, который не входит ни в одно из множеств.
         */
        public Builder category(NodeCategory category, String... kinds) {
            for (String kind : kinds) {
                categories.put(kind, category);
            }
            return this;
        }

        public Builder syntaxTokens(Set<String> tokens) {
            syntaxTokens.clear();
            syntaxTokens.addAll(tokens);
            return this;
        }

        public NodeKindVocabulary build() {
            Set<String> overlap = new HashSet<>(preserveKinds);
            overlap.retainAll(mergeableKinds);
            if (!overlap.isEmpty()) {
                throw new IllegalStateException("Node kinds cannot be both preserved and mergeable: " + overlap);
            }
            return new NodeKindVocabulary(this);
        }
    }
}
