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
package ru.nts.tools.cast.chunk;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.cast.core.CastErrorCode;
import ru.nts.tools.cast.core.CastException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MethodChunkExtractorTest {

    private static final String GREETER = """
            package demo;

            public class Greeter {
                private final String name;

                public Greeter(String name) {
                    this.name = name;
                }

                public String greet() {
                    return "Hello, " + name;
                }

                static class Inner {
                    void ping() {}
                }
            }
            """;

    private final MethodChunkExtractor extractor = new MethodChunkExtractor();

    @Test
    void extractsMethodsAndConstructors() {
        Path path = Path.of("src", "demo", "Greeter.java");

        List<CodeChunk> chunks = extractor.extract(path, GREETER);

        assertEquals(3, chunks.size(), "Constructor, greet and ping expected");
        assertEquals(List.of("Greeter", "greet", "ping"),
                chunks.stream().map(c -> c.metadata().get("method_name")).toList());
    }

    @Test
    void chunkMetadata() {
        Path path = Path.of("Greeter.java");

        CodeChunk greet = extractor.extract(path, GREETER).get(1);

        assertEquals("Greeter.java::greet::10-12", greet.id());
        assertTrue(greet.code().startsWith("public String greet() {"), greet.code());
        assertTrue(greet.code().endsWith("}"), greet.code());
        assertEquals("Greeter.java", greet.metadata().get("file_path"));
        assertEquals("public String greet()", greet.metadata().get("signature"));
        assertEquals(10, greet.metadata().get("start_line"));
        assertEquals(12, greet.metadata().get("end_line"));
        assertEquals("Greeter", greet.metadata().get("class"));
    }

    @Test
    void nestedClassName() {
        CodeChunk ping = extractor.extract(Path.of("Greeter.java"), GREETER).get(2);

        assertEquals("Inner", ping.metadata().get("class"));
        assertEquals("void ping()", ping.metadata().get("signature"));
        assertEquals(15, ping.metadata().get("start_line"));
    }

    @Test
    void fileWithoutMethods() {
        assertTrue(extractor.extract(Path.of("Empty.java"), "interface Marker {}").isEmpty());
        assertTrue(extractor.extract(Path.of("Blank.java"), "").isEmpty());
    }

    @Test
    void extractFromFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("Greeter.java");
        Files.writeString(file, GREETER);

        List<CodeChunk> chunks = extractor.extract(file);

        assertEquals(3, chunks.size());
        assertTrue(chunks.get(0).id().startsWith(file + "::Greeter::"), chunks.get(0).id());
    }

    @Test
    void missingFile(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("Missing.java");

        CastException e = assertThrows(CastException.class, () -> extractor.extract(missing));

        assertEquals(CastErrorCode.FILE_NOT_FOUND, e.getCode());
        assertEquals(missing, e.getContext().get("path"));
    }
}
