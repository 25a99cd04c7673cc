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

import org.treesitter.TSNode;
import ru.nts.tools.cast.core.tree.SourceNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Неизменяемый снимок узла tree-sitter.
 * Все поля копируются при построении, поэтому после разбора узел
 * не зависит от TSTree и не держит ссылку на парсер.
 */
final class TreeSitterSourceNode implements SourceNode {

    private final String kind;
    private final boolean named;
    private final List<SourceNode> children;
    private final byte[] contentBytes;
    private final int startByte;
    private final int endByte;
    private final int startLine;
    private final int endLine;

    private TreeSitterSourceNode(TSNode node, byte[] contentBytes) {
        this.kind = node.getType();
        this.named = node.isNamed();
        this.contentBytes = contentBytes;
        this.startByte = node.getStartByte();
        this.endByte = node.getEndByte();
        this.startLine = TreeSitterUtils.startLine(node);
        this.endLine = TreeSitterUtils.endLine(node);

        int childCount = node.getChildCount();
        List<SourceNode> list = new ArrayList<>(childCount);
        for (int i = 0; i < childCount; i++) {
            TSNode child = node.getChild(i);
            if (child != null && !child.isNull()) {
                list.add(new TreeSitterSourceNode(child, contentBytes));
            }
        }
        this.children = Collections.unmodifiableList(list);
    }

    /**
     * Строит снимок поддерева, начиная с указанного узла.
     *
     * @param root корень (обычно tree.getRootNode())
     * @param contentBytes UTF-8 байты исходника, по которым вычисляется текст
     */
    static SourceNode snapshot(TSNode root, byte[] contentBytes) {
        return new TreeSitterSourceNode(root, contentBytes);
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public List<SourceNode> children() {
        return children;
    }

    @Override
    public String text() {
        if (startByte >= 0 && endByte <= contentBytes.length && startByte < endByte) {
            return new String(contentBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
        }
        return "";
    }

    @Override
    public int startByte() {
        return startByte;
    }

    @Override
    public int endByte() {
        return endByte;
    }

    @Override
    public int startLine() {
        return startLine;
    }

    @Override
    public int endLine() {
        return endLine;
    }

    @Override
    public String toString() {
        return kind + "[" + startLine + "-" + endLine + "]";
    }
}
