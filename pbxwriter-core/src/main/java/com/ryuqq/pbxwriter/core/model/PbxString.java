package com.ryuqq.pbxwriter.core.model;

/**
 * 문자열 노드.
 *
 * @param value 문자열 값 (빈 문자열 허용)
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public record PbxString(String value) implements PbxNode {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public PbxString {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    /**
     * PbxString 생성.
     *
     * @param value 문자열 값
     * @return PbxString 인스턴스
     */
    public static PbxString of(String value) {
        return new PbxString(value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRING;
    }

    @Override
    public boolean isEmpty() {
        return value.isEmpty();
    }
}
