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

import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.LocalDateTime;

/**
 * Диагностический вывод форматтера.
 *
 * <p>Отладочные сообщения идут в stderr только при {@code TSFMT_DEBUG=true}: stdout занят
 * отформатированным текстом или JSON-отчётом. Если задан {@code TSFMT_LOG_FILE}, все сообщения
 * дополнительно пишутся в файл с отметкой времени.
 */
public final class TsfmtLog {

    private static final boolean DEBUG = "true".equalsIgnoreCase(System.getenv("TSFMT_DEBUG"));

    private static final String LOG_FILE = System.getenv("TSFMT_LOG_FILE");
    private static PrintWriter logWriter = null;

    static {
        if (LOG_FILE != null && !LOG_FILE.isBlank()) {
            try {
                logWriter = new PrintWriter(new FileWriter(LOG_FILE, true), true);
            } catch (IOException e) {
                System.err.println("Cannot open log file " + LOG_FILE + ": " + e.getMessage());
            }
        }
    }

    private TsfmtLog() {}

    public static boolean isDebug() {
        return DEBUG;
    }

    /**
     * Отладочное сообщение: в файл лога и, при TSFMT_DEBUG, в stderr.
     */
    public static void debug(String message) {
        toFile(message);
        if (DEBUG) {
            System.err.println(message);
        }
    }

    /**
     * Сообщение для пользователя: всегда в stderr.
     */
    public static void error(String message) {
        toFile(message);
        System.err.println(message);
    }

    private static synchronized void toFile(String message) {
        if (logWriter != null) {
            logWriter.println("[" + LocalDateTime.now() + "] [" + Thread.currentThread().getName() + "] " + message);
        }
    }
}
