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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NodeKindVocabularyTest {

    private final NodeKindVocabulary java = NodeKindVocabulary.java();

    @ParameterizedTest
    @ValueSource(strings = {"if_statement", "for_statement", "enhanced_for_statement", "while_statement",
            "try_statement", "catch_clause", "return_statement", "method_declaration", "class_declaration",
            "block", "assignment_expression"})
    void preservedKinds(String kind) {
        assertTrue(java.isPreserved(kind), kind + " should be preserved");
        assertFalse(java.isMergeable(kind), kind + " should not be mergeable");
    }

    @ParameterizedTest
    @ValueSource(strings = {"expression_statement", "method_invocation", "local_variable_declaration",
            "binary_expression", "argument_list"})
    void mergeableKinds(String kind) {
        assertTrue(java.isMergeable(kind), kind + " should be mergeable");
        assertFalse(java.isPreserved(kind), kind + " should not be preserved");
    }

    @Test
    void preserveAndMergeableAreDisjoint() {
        Set<String> overlap = new HashSet<>(java.preserveKinds());
        overlap.retainAll(java.mergeableKinds());
        assertTrue(overlap.isEmpty(), "Overlap: " + overlap);
    }

    @Test
    void blockContainers() {
        assertTrue(java.isBlockContainer("block"));
        assertTrue(java.isBlockContainer("constructor_body"));
        assertFalse(java.isBlockContainer("class_body"));
        assertFalse(java.isBlockContainer("program"));
    }

    @Test
    void categories() {
        assertEquals(NodeCategory.LOOP, java.categoryOf("while_statement"));
        assertEquals(NodeCategory.CONDITIONAL, java.categoryOf("switch_expression"));
        assertEquals(NodeCategory.CONDITIONAL, java.categoryOf("ternary_expression"));
        assertEquals(NodeCategory.EXCEPTION_HANDLING, java.categoryOf("throw_statement"));
        assertEquals(NodeCategory.EXPRESSION, java.categoryOf("expression_statement"));
        assertEquals(NodeCategory.OTHER, java.categoryOf("ERROR"));
        assertEquals(NodeCategory.OTHER, java.categoryOf("unknown_kind"));
    }

    @Test
    void syntaxTokens() {
        assertTrue(java.isSyntaxToken(";"));
        assertTrue(java.isSyntaxToken("{"));
        assertFalse(java.isSyntaxToken("if"));
        assertFalse(java.isSyntaxToken("="));
    }

    @Test
    void builderRejectsOverlap() {
        NodeKindVocabulary.Builder builder = NodeKindVocabulary.builder()
                .preserve(NodeCategory.OTHER, "statement")
                .mergeable(NodeCategory.OTHER, "statement");
        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void customVocabulary() {
        NodeKindVocabulary custom = NodeKindVocabulary.builder()
                .preserve(NodeCategory.CONDITIONAL, "if")
                .mergeable(NodeCategory.EXPRESSION, "call")
                .blockContainers("body")
                .syntaxTokens(Set.of(";"))
                .build();

        assertTrue(custom.isPreserved("if"));
        assertTrue(custom.isMergeable("call"));
        assertTrue(custom.isBlockContainer("body"));
        assertTrue(custom.isSyntaxToken(";"));
        assertFalse(custom.isSyntaxToken("("), "Default syntax tokens replaced");
        assertFalse(custom.isPreserved("if_statement"));
    }
}
