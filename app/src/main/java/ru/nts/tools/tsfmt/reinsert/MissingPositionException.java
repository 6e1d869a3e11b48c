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
package ru.nts.tools.tsfmt.reinsert;

import ru.nts.tools.tsfmt.core.TsfmtErrorCode;
import ru.nts.tools.tsfmt.core.TsfmtException;
import ru.nts.tools.tsfmt.identity.NodeIdentity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Владельцы комментариев не найдены в скелете. Перечисляет все недостающие идентичности сразу,
 * частичный результат не возвращается.
 */
public class MissingPositionException extends TsfmtException {

    private final List<NodeIdentity> missing;

    public MissingPositionException(List<NodeIdentity> missing) {
        super(TsfmtErrorCode.MISSING_POSITION, createContext(missing));
        this.missing = List.copyOf(missing);
    }

    private static Map<String, Object> createContext(List<NodeIdentity> missing) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("missing", missing.stream().map(NodeIdentity::label).collect(Collectors.joining(", ")));
        ctx.put("count", missing.size());
        return ctx;
    }

    public List<NodeIdentity> getMissing() {
        return missing;
    }
}
