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
package ru.nts.tools.tsfmt.identity;

import java.nio.charset.StandardCharsets;

/**
 * Идентичность узла, вычисленная из его содержимого (вид, имя, модификаторы, форма сигнатуры),
 * а не из позиции. Сравнение идёт только по 64-битному хешу; {@link #label()} нужен для
 * сообщений об ошибках и имён групп.
 *
 * <p>Структурно одинаковые объявления в одной области видимости дают одинаковую идентичность.
 */
public record NodeIdentity(long hash, String label) {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    /**
     * Идентичность из тега вида и канонического ключа.
     */
    public static NodeIdentity of(String kind, String key) {
        return new NodeIdentity(hash(kind + '\u0000' + key), kind + ":" + key);
    }

    /**
     * FNV-1a по UTF-8 байтам строки.
     */
    public static long hash(String value) {
        long h = FNV_OFFSET;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xff);
            h *= FNV_PRIME;
        }
        return h;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NodeIdentity other && other.hash == hash;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(hash);
    }

    @Override
    public String toString() {
        return label;
    }
}
