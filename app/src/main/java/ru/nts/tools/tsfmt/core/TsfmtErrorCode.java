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
package ru.nts.tools.tsfmt.core;

import java.util.Map;

/**
 * Structured error codes for tsfmt.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example of a rendered error:
 * <pre>
 * [ERROR: PARSE_FAILED]
 * Message: Source contains syntax errors
 * Solution: Fix the syntax error at 12:5 first. tsfmt never rewrites files it cannot parse.
 * Context: path=src/app.ts, line=12, column=5
 * </pre>
 */
public enum TsfmtErrorCode {

    // ============ File Errors ============

    FILE_NOT_FOUND("File not found",
            "Check file path. Directories are walked recursively, globs are not expanded."),

    FILE_NOT_READABLE("File not readable",
            "Check file permissions. Ensure the file is not locked."),

    FILE_IS_BINARY("Binary file detected",
            "Only text sources can be formatted. Exclude the file in tsfmt.json."),

    FILE_ENCODING_ERROR("Cannot decode file content",
            "Save the file as UTF-8 or remove characters that are invalid in '%charset%'."),

    WRITE_FAILED("Cannot write formatted file",
            "Check that '%path%' is writable and not locked by another process."),

    // ============ Parse Errors ============

    UNSUPPORTED_LANGUAGE("Unsupported file type",
            "Supported extensions: ts, tsx, mts, cts, js, jsx, mjs, cjs."),

    PARSE_FAILED("Source contains syntax errors",
            "Fix the syntax error at %line%:%column% first. tsfmt never rewrites files it cannot parse."),

    // ============ Formatting Errors ============

    MISSING_POSITION("Comment owner not found after reorganization",
            "Identities without position: %missing%. The file was left unchanged; please report the input."),

    // ============ Configuration Errors ============

    CONFIG_INVALID("Invalid configuration",
            "Check '%key%' in %path%. Expected %expected%."),

    // ============ System Errors ============

    INTERNAL_ERROR("Internal formatter error",
            "The file was left unchanged. Please report the input: %detail%");

    private final String message;
    private final String solution;

    TsfmtErrorCode(String message, String solution) {
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
     * @param context Optional context map (path, line, etc.)
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
        // Очищаем неиспользованные плейсхолдеры
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

    /**
     * Formats error message without context.
     *
     * @return Formatted error string
     */
    public String format() {
        return format(null);
    }
}
