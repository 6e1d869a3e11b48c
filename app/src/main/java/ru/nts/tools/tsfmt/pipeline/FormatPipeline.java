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

import ru.nts.tools.tsfmt.comments.CommentExtractor;
import ru.nts.tools.tsfmt.comments.ExtractionResult;
import ru.nts.tools.tsfmt.core.FormatterConfig;
import ru.nts.tools.tsfmt.core.TsfmtErrorCode;
import ru.nts.tools.tsfmt.core.TsfmtException;
import ru.nts.tools.tsfmt.core.TsfmtLog;
import ru.nts.tools.tsfmt.core.treesitter.SyntaxChecker;
import ru.nts.tools.tsfmt.organize.Reorganizer;
import ru.nts.tools.tsfmt.organize.TypeScriptReorganizer;
import ru.nts.tools.tsfmt.position.PositionIndex;
import ru.nts.tools.tsfmt.position.PositionRecoverer;
import ru.nts.tools.tsfmt.print.SkeletonPrinter;
import ru.nts.tools.tsfmt.print.StylePass;
import ru.nts.tools.tsfmt.reinsert.CommentReinserter;
import ru.nts.tools.tsfmt.syntax.CommentStore;
import ru.nts.tools.tsfmt.syntax.SyntaxParser;
import ru.nts.tools.tsfmt.syntax.SyntaxTree;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Конвейер форматирования одного текста.
 *
 * <p>Этапы: разбор, извлечение комментариев по идентичностям, реорганизация дерева, печать
 * скелета без извлечённых комментариев, поиск узлов в скелете, вставка комментариев обратно,
 * косметический проход. Экземпляр не хранит состояния между вызовами и может использоваться
 * из нескольких потоков.
 */
public final class FormatPipeline {

    private final FormatterConfig config;
    private final Reorganizer reorganizer;

    public FormatPipeline(FormatterConfig config) {
        this.config = config;
        this.reorganizer = new TypeScriptReorganizer(config.rules());
    }

    /**
     * Форматирует текст.
     *
     * @param source исходный текст с переводами строк LF
     * @param langId идентификатор языка (typescript, tsx, javascript)
     * @throws TsfmtException PARSE_FAILED, если исходник или результат содержит синтаксические ошибки
     * @throws ru.nts.tools.tsfmt.reinsert.MissingPositionException если владелец комментария потерян
     */
    public FormatResult format(String source, String langId) {
        SyntaxTree tree = SyntaxParser.parse(source, langId);
        if (tree.hasErrors()) {
            throw parseFailed(tree.syntax(), "source");
        }

        CommentStore store = CommentStore.build(tree);
        ExtractionResult extraction = CommentExtractor.extract(tree, store);
        TsfmtLog.debug("Extracted " + extraction.extractedCount() + " attached and "
                + extraction.standalone().size() + " standalone comments");

        reorganizer.reorganize(tree);
        String skeleton = new SkeletonPrinter(tree, extraction.movedComments(), config.indent()).print(tree.root());

        PositionIndex positions = PositionRecoverer.recover(skeleton, langId);
        String text = CommentReinserter.reinsert(extraction, skeleton, positions);
        String formatted = StylePass.apply(text, langId);

        SyntaxChecker.SyntaxCheckResult check = SyntaxChecker.checkContent(formatted, langId);
        if (check.hasErrors()) {
            throw parseFailed(check, "result");
        }
        return new FormatResult(source, formatted, extraction.extractedCount(), extraction.standalone().size());
    }

    private static TsfmtException parseFailed(SyntaxChecker.SyntaxCheckResult check, String stage) {
        SyntaxChecker.SyntaxError first = check.errors().get(0);
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("stage", stage);
        ctx.put("line", first.line());
        ctx.put("column", first.column());
        ctx.put("detail", first.message());
        return new TsfmtException(TsfmtErrorCode.PARSE_FAILED, ctx);
    }
}
