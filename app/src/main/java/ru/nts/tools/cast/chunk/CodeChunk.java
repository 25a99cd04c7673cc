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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Фрагмент кода для индексации (обычно один метод).
 *
 * @param id идентификатор вида {@code path::method::start-end}
 * @param code исходный текст фрагмента
 * @param metadata произвольные метаданные (порядок ключей сохраняется)
 */
public record CodeChunk(String id, String code, Map<String, Object> metadata) {

    public CodeChunk {
        code = code != null ? code : "";
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    public CodeChunk(String id, String code) {
        this(id, code, Map.of());
    }
}
