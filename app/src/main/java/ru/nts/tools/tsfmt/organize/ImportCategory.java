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
package ru.nts.tools.tsfmt.organize;

/**
 * Группа импорта по виду пути модуля. Порядок констант задаёт порядок групп в файле.
 */
public enum ImportCategory {
    /** Пакеты: {@code react}, {@code lodash/fp}. */
    EXTERNAL,
    /** Псевдонимы путей: {@code @app/...}, {@code ~/...}. */
    ABSOLUTE,
    /** Относительные пути: {@code ./x}, {@code ../y}. */
    RELATIVE;

    public static ImportCategory of(String moduleSource) {
        if (moduleSource.startsWith(".")) {
            return RELATIVE;
        }
        if (moduleSource.startsWith("@") || moduleSource.startsWith("~")) {
            return ABSOLUTE;
        }
        return EXTERNAL;
    }
}
