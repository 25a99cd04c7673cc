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

/**
 * Возможность разбора исходного текста в дерево.
 * Реализация должна быть реентерабельной либо вызываться из одного потока.
 * Ожидается устойчивость к ошибкам: для некорректного текста возвращается
 * дерево "по мере возможности", а не исключение.
 */
public interface SourceParser {

    /**
     * Идентификатор языка грамматики (например "java").
     */
    String languageId();

    /**
     * Разбирает текст и возвращает корень дерева.
     *
     * @param text исходный код
     * @return корневой узел
     */
    SourceNode parse(String text);
}
