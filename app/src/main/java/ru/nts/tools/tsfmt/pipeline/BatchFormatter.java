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
package ru.nts.tools.tsfmt.pipeline;

import ru.nts.tools.tsfmt.core.EncodingUtils;
import ru.nts.tools.tsfmt.core.FileUtils;
import ru.nts.tools.tsfmt.core.FormatterConfig;
import ru.nts.tools.tsfmt.core.TsfmtErrorCode;
import ru.nts.tools.tsfmt.core.TsfmtException;
import ru.nts.tools.tsfmt.core.TsfmtLog;
import ru.nts.tools.tsfmt.core.treesitter.LanguageDetector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Форматирует набор файлов параллельно на фиксированном пуле потоков.
 * Каждый файл проходит свой конвейер; ошибка одного файла попадает в его отчёт и не
 * влияет на остальные.
 */
public final class BatchFormatter {

    public enum Mode {
        /** Перезаписать изменённые файлы. */
        WRITE,
        /** Только сообщить, какие файлы изменились бы. */
        CHECK,
        /** Вернуть текст в отчёте, ничего не записывая. */
        STDOUT
    }

    public enum Status { UNCHANGED, FORMATTED, WOULD_CHANGE, FAILED }

    /**
     * Отчёт по одному файлу.
     *
     * @param formatted отформатированный текст (только в режиме STDOUT)
     * @param error     сообщение об ошибке для пользователя (только для FAILED)
     * @param errorCode код ошибки (только для FAILED)
     */
    public record FileReport(Path path, Status status, int attachedComments, int standaloneComments,
                             String formatted, String error, TsfmtErrorCode errorCode) {

        static FileReport failed(Path path, TsfmtException e) {
            return new FileReport(path, Status.FAILED, 0, 0, null, e.toUserMessage(), e.getCode());
        }
    }

    private final FormatPipeline pipeline;
    private final Mode mode;
    private final boolean backup;
    private final int threads;

    public BatchFormatter(FormatterConfig config, Mode mode, boolean backup, int threads) {
        this.pipeline = new FormatPipeline(config);
        this.mode = mode;
        this.backup = backup;
        this.threads = Math.max(1, threads);
    }

    /**
     * Форматирует файлы. Отчёты возвращаются в порядке входного списка.
     */
    public List<FileReport> run(List<Path> files) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, files.size())));
        try {
            List<Future<FileReport>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> formatFile(file)));
            }

            List<FileReport> reports = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                Path file = files.get(i);
                try {
                    reports.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    TsfmtLog.error("Unexpected failure on " + file + ": " + cause);
                    reports.add(FileReport.failed(file, new TsfmtException(TsfmtErrorCode.INTERNAL_ERROR,
                            Map.of("path", file.toString(), "detail", String.valueOf(cause.getMessage())), cause)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Formatting interrupted", e);
                }
            }
            return reports;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Полный цикл одного файла: чтение с определением кодировки, конвейер, запись в исходной
     * кодировке и стиле переводов строк.
     */
    public FileReport formatFile(Path file) {
        try {
            if (!Files.exists(file)) {
                throw new TsfmtException(TsfmtErrorCode.FILE_NOT_FOUND, "path", file.toString());
            }
            String langId = LanguageDetector.detect(file)
                    .orElseThrow(() -> new TsfmtException(TsfmtErrorCode.UNSUPPORTED_LANGUAGE, "path", file.toString()));

            EncodingUtils.TextFileContent content;
            try {
                content = EncodingUtils.readTextFile(file);
            } catch (IOException e) {
                throw new TsfmtException(TsfmtErrorCode.FILE_NOT_READABLE, Map.of("path", file.toString()), e);
            }

            long startTime = System.currentTimeMillis();
            FormatResult result = pipeline.format(content.content(), langId);
            TsfmtLog.debug("Formatted " + file + " in " + (System.currentTimeMillis() - startTime) + " ms");

            if (mode == Mode.STDOUT) {
                return report(file, Status.FORMATTED, result, result.fileText());
            }
            if (!result.changed()) {
                return report(file, Status.UNCHANGED, result, null);
            }
            if (mode == Mode.CHECK) {
                return report(file, Status.WOULD_CHANGE, result, null);
            }

            try {
                if (backup) {
                    FileUtils.createBackup(file);
                }
                FileUtils.safeWrite(file, content.restoreStyle(result.fileText()), content.charset());
            } catch (IOException e) {
                throw new TsfmtException(TsfmtErrorCode.WRITE_FAILED, Map.of("path", file.toString()), e);
            }
            return report(file, Status.FORMATTED, result, null);
        } catch (TsfmtException e) {
            TsfmtLog.debug(file + ": " + e.toLogMessage());
            return FileReport.failed(file, e);
        }
    }

    private static FileReport report(Path file, Status status, FormatResult result, String formatted) {
        return new FileReport(file, status, result.attachedComments(), result.standaloneComments(), formatted,
                null, null);
    }
}
