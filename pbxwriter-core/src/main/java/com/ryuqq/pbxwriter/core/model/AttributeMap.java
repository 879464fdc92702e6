package com.ryuqq.pbxwriter.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 삽입 순서를 보존하는 이름 → 노드 저장소.
 *
 * <p>{@link LinkedHashMap}은 기존 키를 덮어써도 위치가 유지되므로
 * "덮어쓰기는 자리 유지, 새 이름은 끝에 추가" 규칙을 그대로 만족합니다.</p>
 */
final class AttributeMap {

    private final Map<String, PbxNode> attributes = new LinkedHashMap<>();

    void set(String name, PbxNode value) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        attributes.put(name, value);
    }

    PbxNode get(String name) {
        return attributes.get(name);
    }

    boolean contains(String name) {
        return attributes.containsKey(name);
    }

    PbxNode remove(String name) {
        return attributes.remove(name);
    }

    void replaceWith(AttributeMap other) {
        attributes.clear();
        attributes.putAll(other.attributes);
    }

    int size() {
        return attributes.size();
    }

    Map<String, PbxNode> view() {
        return Collections.unmodifiableMap(attributes);
    }
}
