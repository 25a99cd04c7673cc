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
package ru.nts.tools.cast.core;

import java.util.Map;

/**
 * Structured error codes for the cAST compressor.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example output:
 * <pre>
 * [ERROR: CONFIG_INVALID]
 * Message: Invalid compression configuration
 * Solution: Value of CAST_SIMILARITY_THRESHOLD must be a number in (0, 1], got 'abc'.
 * Context: key=CAST_SIMILARITY_THRESHOLD, value=abc
 * </pre>
 */
public enum CastErrorCode {

    // ============ Parser Errors ============

    PARSER_UNAVAILABLE("Parser not available",
            "tree-sitter grammar for '%language%' could not be loaded. Compression falls back to passthrough."),

    LANGUAGE_UNSUPPORTED("Unsupported language",
            "Language '%language%' has no grammar. Supported: java."),

    // ============ Configuration Errors ============

    CONFIG_INVALID("Invalid compression configuration",
            "Value of %key% must be a number in (0, 1], got '%value%'."),

    // ============ File Errors ============

    FILE_NOT_FOUND("File not found",
            "Check file path '%path%'."),

    FILE_NOT_READABLE("File not readable",
            "Check permissions and encoding of '%path%' (UTF-8 expected).");

    private final String message;
    private final String solution;

    CastErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, key, value, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }
        return sb.toString();
    }

    public String format() {
        return format(null);
    }
}
