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

/**
 * Семейство конструкций, к которому относится тип узла.
 * Вычисляется один раз при классификации из строки типа.
 */
public enum NodeCategory {
    LOOP(true),
    CONDITIONAL(true),
    EXCEPTION_HANDLING(true),
    DECLARATION(false),
    EXPRESSION(false),
    OTHER(false);

    private final boolean controlFlowFamily;

    NodeCategory(boolean controlFlowFamily) {
        this.controlFlowFamily = controlFlowFamily;
    }

    /**
     * Разные типы одного управляющего семейства (for / enhanced_for) считаются родственными
     * при оценке сходства.
     */
    public boolean isControlFlowFamily() {
        return controlFlowFamily;
    }
}
