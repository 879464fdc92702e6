package com.ryuqq.pbxwriter.core.model;

import java.util.Map;

/**
 * 식별자 없는 이름 → 노드 묶음 (예: {@code buildSettings}).
 *
 * <p>속성은 삽입 순서대로 출력됩니다. 이미 있는 이름을 다시 설정하면 값만 교체되고
 * 위치는 유지됩니다.</p>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public final class PbxAttributeGroup implements PbxNode {

    private final AttributeMap attributes = new AttributeMap();

    /**
     * 빈 묶음 생성.
     */
    public PbxAttributeGroup() {
    }

    /**
     * 속성 설정 (덮어쓰기).
     *
     * @param name 속성 이름
     * @param value 속성 값
     * @throws IllegalArgumentException name 또는 value가 null인 경우
     */
    public void setAttribute(String name, PbxNode value) {
        attributes.set(name, value);
    }

    /**
     * 값이 비어 있지 않을 때만 속성 설정.
     *
     * @param name 속성 이름
     * @param value 속성 값
     * @return 설정되었으면 true
     */
    public boolean setAttributeIfNotEmpty(String name, PbxNode value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        attributes.set(name, value);
        return true;
    }

    /**
     * 속성 조회.
     *
     * @param name 속성 이름
     * @return 속성 값, 없으면 null
     */
    public PbxNode getAttribute(String name) {
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return attributes.contains(name);
    }

    public PbxNode removeAttribute(String name) {
        return attributes.remove(name);
    }

    /**
     * 삽입 순서대로의 속성 (읽기 전용 view).
     *
     * @return 속성 map
     */
    public Map<String, PbxNode> attributes() {
        return attributes.view();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE_GROUP;
    }

    @Override
    public boolean isEmpty() {
        return attributes.size() == 0;
    }
}
