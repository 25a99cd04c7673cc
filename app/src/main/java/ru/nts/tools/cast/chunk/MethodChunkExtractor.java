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

import org.treesitter.TSNode;
import org.treesitter.TSTree;
import ru.nts.tools.cast.core.CastErrorCode;
import ru.nts.tools.cast.core.CastException;
import ru.nts.tools.cast.core.treesitter.TreeSitterManager;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static ru.nts.tools.cast.core.treesitter.TreeSitterUtils.*;

/**
 * Извлекает методы и конструкторы Java файла как отдельные чанки.
 * Обходит дерево напрямую; тела методов не обходятся, поэтому чанки не пересекаются.
 */
public final class MethodChunkExtractor {

    private static final Set<String> TYPE_DECLARATIONS = Set.of(
            "class_declaration", "interface_declaration", "enum_declaration", "record_declaration"
    );

    private static final Set<String> METHOD_DECLARATIONS = Set.of(
            "method_declaration", "constructor_declaration"
    );

    private final TreeSitterManager manager;

    public MethodChunkExtractor() {
        this(TreeSitterManager.getInstance());
    }

    MethodChunkExtractor(TreeSitterManager manager) {
        this.manager = manager;
    }

    /**
     * Читает файл (UTF-8) и извлекает чанки.
     *
     * @throws CastException FILE_NOT_FOUND или FILE_NOT_READABLE
     */
    public List<CodeChunk> extract(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new CastException(CastErrorCode.FILE_NOT_FOUND, Map.of("path", path), e);
        } catch (IOException e) {
            throw new CastException(CastErrorCode.FILE_NOT_READABLE, Map.of("path", path), e);
        }
        return extract(path, content);
    }

    /**
     * Извлекает чанки из содержимого.
     *
     * @param path путь (используется в id и метаданных)
     * @param content исходный код Java
     */
    public List<CodeChunk> extract(Path path, String content) {
        TSTree tree = manager.parse(content, "java");
        byte[] contentBytes = content.getBytes(StandardCharsets.UTF_8);
        List<CodeChunk> chunks = new ArrayList<>();
        collect(tree.getRootNode(), path, contentBytes, null, chunks);
        return chunks;
    }

    private void collect(TSNode node, Path path, byte[] contentBytes, String className, List<CodeChunk> chunks) {
        String nodeType = node.getType();

        if (METHOD_DECLARATIONS.contains(nodeType)) {
            toChunk(node, path, contentBytes, className).ifPresent(chunks::add);
            return;
        }

        String enclosingClass = className;
        if (TYPE_DECLARATIONS.contains(nodeType)) {
            TSNode nameNode = findChildByType(node, "identifier");
            if (nameNode != null) {
                enclosingClass = getNodeTextFromBytes(nameNode, contentBytes);
            }
        }

        int childCount = node.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                collect(child, path, contentBytes, enclosingClass, chunks);
            }
        }
    }

    private Optional<CodeChunk> toChunk(TSNode node, Path path, byte[] contentBytes, String className) {
        TSNode nameNode = findChildByType(node, "identifier");
        if (nameNode == null) return Optional.empty();

        String methodName = getNodeTextFromBytes(nameNode, contentBytes);
        String code = getNodeTextFromBytes(node, contentBytes);
        int startLine = startLine(node);
        int endLine = endLine(node);
        String filePath = path != null ? path.toString() : "";

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("file_path", filePath);
        metadata.put("method_name", methodName);
        metadata.put("signature", extractMethodSignature(code));
        metadata.put("start_line", startLine);
        metadata.put("end_line", endLine);
        metadata.put("class", className != null ? className : "");

        String id = filePath + "::" + methodName + "::" + startLine + "-" + endLine;
        return Optional.of(new CodeChunk(id, code, metadata));
    }
}
