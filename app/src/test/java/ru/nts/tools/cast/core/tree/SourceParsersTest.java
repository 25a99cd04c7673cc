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

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SourceParsersTest {

    @Test
    void javaParserIsAvailable() {
        Optional<SourceParser> parser = SourceParsers.forLanguage("java");

        assertTrue(parser.isPresent(), "tree-sitter Java grammar should load");
        assertEquals("java", parser.get().languageId());
        assertEquals("program", parser.get().parse("class A {}").kind());
    }

    @Test
    void unsupportedLanguageIsEmpty() {
        assertTrue(SourceParsers.forLanguage("cobol").isEmpty());
        assertTrue(SourceParsers.forLanguage(null).isEmpty());
    }
}
