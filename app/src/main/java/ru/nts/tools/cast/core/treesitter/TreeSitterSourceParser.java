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

import org.treesitter.TSTree;
import ru.nts.tools.cast.core.tree.SourceNode;
import ru.nts.tools.cast.core.tree.SourceParser;

import java.nio.charset.StandardCharsets;

/**
 * Реализация {@link SourceParser} поверх tree-sitter.
 * Реентерабельна: парсеры берутся из ThreadLocal пула {@link TreeSitterManager}.
 */
public final class TreeSitterSourceParser implements SourceParser {

    private final String langId;
    private final TreeSitterManager manager;

    public TreeSitterSourceParser(String langId) {
        this(langId, TreeSitterManager.getInstance());
    }

    TreeSitterSourceParser(String langId, TreeSitterManager manager) {
        this.langId = langId;
        this.manager = manager;
    }

    @Override
    public String languageId() {
        return langId;
    }

    @Override
    public SourceNode parse(String text) {
        String content = text != null ? text : "";
        TSTree tree = manager.parse(content, langId);
        // Снимок строится пока дерево достижимо: узлы tree-sitter живут не дольше TSTree
        return TreeSitterSourceNode.snapshot(tree.getRootNode(), content.getBytes(StandardCharsets.UTF_8));
    }
}
