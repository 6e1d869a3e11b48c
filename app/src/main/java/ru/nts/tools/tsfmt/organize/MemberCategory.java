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

import ru.nts.tools.tsfmt.syntax.SyntaxNode;

/**
 * Категория члена класса. Порядок констант задаёт порядок членов в теле класса.
 */
public enum MemberCategory {
    PUBLIC_STATIC_FIELD,
    PRIVATE_STATIC_FIELD,
    PUBLIC_STATIC_METHOD,
    PRIVATE_STATIC_METHOD,
    PUBLIC_INSTANCE_FIELD,
    PRIVATE_INSTANCE_FIELD,
    CONSTRUCTOR,
    PUBLIC_INSTANCE_METHOD,
    PRIVATE_INSTANCE_METHOD,
    OTHER;

    /**
     * Категория члена тела класса. {@code private}, {@code protected} и {@code #имя} считаются приватными.
     */
    public static MemberCategory of(SyntaxNode member, String source) {
        boolean field = member.is("public_field_definition") || member.is("field_definition");
        boolean method = member.is("method_definition") || member.is("method_signature")
                || member.is("abstract_method_signature");
        if (!field && !method) {
            return OTHER;
        }

        SyntaxNode name = member.childByField("name");
        if (name == null) name = member.childByField("property");
        if (method && name != null && "constructor".equals(name.text(source))) {
            return CONSTRUCTOR;
        }

        boolean isStatic = member.hasChild("static");
        boolean isPrivate = name != null && name.is("private_property_identifier");
        SyntaxNode accessibility = member.firstChild("accessibility_modifier");
        if (accessibility != null) {
            String modifier = accessibility.text(source);
            isPrivate |= modifier.equals("private") || modifier.equals("protected");
        }

        if (field) {
            if (isStatic) return isPrivate ? PRIVATE_STATIC_FIELD : PUBLIC_STATIC_FIELD;
            return isPrivate ? PRIVATE_INSTANCE_FIELD : PUBLIC_INSTANCE_FIELD;
        }
        if (isStatic) return isPrivate ? PRIVATE_STATIC_METHOD : PUBLIC_STATIC_METHOD;
        return isPrivate ? PRIVATE_INSTANCE_METHOD : PUBLIC_INSTANCE_METHOD;
    }

    public boolean isField() {
        return this == PUBLIC_STATIC_FIELD || this == PRIVATE_STATIC_FIELD
                || this == PUBLIC_INSTANCE_FIELD || this == PRIVATE_INSTANCE_FIELD;
    }
}
