package com.metaget.core.model;

import java.util.Objects;

/**
 * 추출된 meta 선언 1건: (name, content).
 * name 은 {@code name} 또는 {@code property} 속성값 중 태그에서 마지막으로 나온 쪽.
 * 두 값 모두 비어 있지 않아야 한다.
 */
public record MetaTag(String name, String content) {
    public MetaTag {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(content, "content");
        if (name.isEmpty()) throw new IllegalArgumentException("name must not be empty");
        if (content.isEmpty()) throw new IllegalArgumentException("content must not be empty");
    }

    public static MetaTag of(String name, String content) {
        return new MetaTag(name, content);
    }
}
