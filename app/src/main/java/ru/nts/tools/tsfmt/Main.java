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
package ru.nts.tools.tsfmt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.tsfmt.core.FormatterConfig;
import ru.nts.tools.tsfmt.core.TsfmtErrorCode;
import ru.nts.tools.tsfmt.core.TsfmtException;
import ru.nts.tools.tsfmt.core.TsfmtLog;
import ru.nts.tools.tsfmt.pipeline.BatchFormatter;
import ru.nts.tools.tsfmt.pipeline.BatchFormatter.FileReport;
import ru.nts.tools.tsfmt.pipeline.BatchFormatter.Status;
import ru.nts.tools.tsfmt.pipeline.FileDiscovery;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Точка входа tsfmt.
 *
 * <pre>
 * tsfmt [--check] [--stdout] [--no-backup] [--json] [--config &lt;file&gt;] &lt;paths...&gt;
 * </pre>
 * Код возврата 1, если хотя бы один файл не удалось обработать или (с {@code --check})
 * хотя бы один файл изменился бы; иначе 0.
 */
public final class Main {

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private static final String USAGE = """
            Usage: tsfmt [options] <paths...>
              --check          report files that would change, write nothing
              --stdout         print formatted text instead of writing files
              --no-backup      do not create <file>.bak before overwriting
              --json           print a machine-readable summary
              --config <file>  configuration file (default: ./tsfmt.json)""";

    record Options(boolean check, boolean stdout, boolean noBackup, boolean json, Path config, List<Path> paths) {
    }

    private Main() {}

    public static void main(String[] args) {
        // Кириллица в сообщениях и исходники в UTF-8 не должны зависеть от системной кодировки консоли
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Выполняет команду.
     *
     * @return код возврата процесса
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 1;
        }

        try {
            Path configPath = options.config() != null ? options.config() : Path.of(FormatterConfig.FILE_NAME);
            if (options.config() != null && !Files.isRegularFile(configPath)) {
                throw new TsfmtException(TsfmtErrorCode.FILE_NOT_FOUND, "path", configPath.toString());
            }
            FormatterConfig config = FormatterConfig.load(configPath);
            TsfmtLog.debug("Configuration: " + config);

            List<Path> files = FileDiscovery.discover(options.paths(), config);
            TsfmtLog.debug("Discovered " + files.size() + " files");

            BatchFormatter.Mode mode = options.check() ? BatchFormatter.Mode.CHECK
                    : options.stdout() ? BatchFormatter.Mode.STDOUT : BatchFormatter.Mode.WRITE;
            boolean backup = config.backup() && !options.noBackup();
            BatchFormatter formatter = new BatchFormatter(config, mode, backup,
                    Runtime.getRuntime().availableProcessors());
            List<FileReport> reports = formatter.run(files);

            if (options.json()) {
                out.println(toJson(reports));
            } else {
                printReport(reports, mode, out, err);
            }
            return exitCode(reports);
        } catch (TsfmtException e) {
            err.println(e.toUserMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }

    static Options parseArgs(String[] args) {
        boolean check = false;
        boolean stdout = false;
        boolean noBackup = false;
        boolean json = false;
        Path config = null;
        List<Path> paths = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--check" -> check = true;
                case "--stdout" -> stdout = true;
                case "--no-backup" -> noBackup = true;
                case "--json" -> json = true;
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config requires a file argument");
                    }
                    config = Path.of(args[++i]);
                }
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    paths.add(Path.of(arg));
                }
            }
        }
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("No paths given");
        }
        if (check && stdout) {
            throw new IllegalArgumentException("--check and --stdout cannot be combined");
        }
        return new Options(check, stdout, noBackup, json, config, paths);
    }

    static int exitCode(List<FileReport> reports) {
        for (FileReport report : reports) {
            if (report.status() == Status.FAILED || report.status() == Status.WOULD_CHANGE) {
                return 1;
            }
        }
        return 0;
    }

    private static void printReport(List<FileReport> reports, BatchFormatter.Mode mode, PrintStream out,
                                    PrintStream err) {
        Map<Status, Integer> counts = new EnumMap<>(Status.class);
        for (FileReport report : reports) {
            counts.merge(report.status(), 1, Integer::sum);
            switch (report.status()) {
                case FORMATTED -> {
                    if (mode == BatchFormatter.Mode.STDOUT) {
                        out.print(report.formatted());
                    } else {
                        err.println("formatted: " + report.path());
                    }
                }
                case WOULD_CHANGE -> err.println("would change: " + report.path());
                case FAILED -> err.println(report.path() + "\n" + report.error());
                case UNCHANGED -> TsfmtLog.debug("unchanged: " + report.path());
            }
        }
        err.println(reports.size() + " file(s): "
                + counts.getOrDefault(Status.FORMATTED, 0) + " formatted, "
                + counts.getOrDefault(Status.WOULD_CHANGE, 0) + " would change, "
                + counts.getOrDefault(Status.UNCHANGED, 0) + " unchanged, "
                + counts.getOrDefault(Status.FAILED, 0) + " failed");
    }

    static String toJson(List<FileReport> reports) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode files = root.putArray("files");
        int failed = 0;
        int changed = 0;
        for (FileReport report : reports) {
            ObjectNode file = files.addObject();
            file.put("path", report.path().toString());
            file.put("status", report.status().name());
            file.put("attachedComments", report.attachedComments());
            file.put("standaloneComments", report.standaloneComments());
            if (report.formatted() != null) {
                file.put("formatted", report.formatted());
            }
            if (report.status() == Status.FAILED) {
                file.put("code", report.errorCode().name());
                file.put("error", report.error());
                failed++;
            } else if (report.status() != Status.UNCHANGED) {
                changed++;
            }
        }
        ObjectNode summary = root.putObject("summary");
        summary.put("total", reports.size());
        summary.put("changed", changed);
        summary.put("failed", failed);
        return mapper.writeValueAsString(root);
    }
}
