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

import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class TreeSitterUtilsTest {

    @Test
    void extractMethodSignature() {
        assertEquals("public int add(int a, int b)",
                TreeSitterUtils.extractMethodSignature("public int add(int a,\n        int b) {\n    return a + b;\n}"));
        assertEquals("abstract void run()", TreeSitterUtils.extractMethodSignature("abstract void run();"));
        assertEquals("void noBody()", TreeSitterUtils.extractMethodSignature("  void noBody()  "));
    }

    @Test
    void nodeTextAndLines() {
        String code = "class A {\n    String greeting = \"Привет\";\n}\n";
        byte[] bytes = code.getBytes(StandardCharsets.UTF_8);
        TSTree tree = TreeSitterManager.getInstance().parse(code, "java");

        TSNode classNode = TreeSitterUtils.findChildByType(tree.getRootNode(), "class_declaration");
        assertNotNull(classNode);
        assertEquals("A", TreeSitterUtils.getNodeTextFromBytes(
                TreeSitterUtils.findChildByType(classNode, "identifier"), bytes));
        assertEquals(1, TreeSitterUtils.startLine(classNode));
        assertEquals(3, TreeSitterUtils.endLine(classNode));

        TSNode body = TreeSitterUtils.findChildByType(classNode, "class_body");
        TSNode field = TreeSitterUtils.findChildByType(body, "field_declaration");
        assertEquals("String greeting = \"Привет\";", TreeSitterUtils.getNodeTextFromBytes(field, bytes));
        assertNull(TreeSitterUtils.findChildByType(classNode, "method_declaration"));
    }
}
