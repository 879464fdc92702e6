package com.ryuqq.pbxwriter.core.model;

/**
 * {@link PbxNode}의 종류 태그.
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public enum NodeKind {

    /**
     * 문자열 스칼라.
     */
    STRING,

    /**
     * 다른 객체에 대한 비소유 참조.
     */
    OBJECT_REF,

    /**
     * 순서가 있는 노드 목록.
     */
    OBJECT_LIST,

    /**
     * 식별자 없는 이름 → 노드 묶음.
     */
    ATTRIBUTE_GROUP,

    /**
     * 식별자를 가진 최상위 객체.
     */
    OBJECT
}
