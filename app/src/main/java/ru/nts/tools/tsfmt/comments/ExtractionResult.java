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
package ru.nts.tools.tsfmt.comments;

import ru.nts.tools.tsfmt.identity.NodeIdentity;
import ru.nts.tools.tsfmt.syntax.Comment;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Результат извлечения: комментарии по идентичностям владельцев и отдельно стоящие комментарии.
 */
public record ExtractionResult(Map<NodeIdentity, List<ExtractedComment>> byIdentity,
                               List<StandaloneComment> standalone) {

    /**
     * Все комментарии, которые убираются из скелета и вставляются заново.
     */
    public Set<Comment> movedComments() {
        Set<Comment> result = new HashSet<>();
        byIdentity.values().forEach(list -> list.forEach(e -> result.add(e.comment())));
        standalone.forEach(s -> result.add(s.comment()));
        return result;
    }

    public int extractedCount() {
        return byIdentity.values().stream().mapToInt(List::size).sum();
    }
}
