package com.ryuqq.pbxwriter.core.model;

/**
 * PBX 객체 그래프 노드.
 *
 * <p>다섯 가지 종류로 닫혀 있는 sealed interface입니다:</p>
 * <ul>
 *   <li>{@link PbxString}: 문자열 값</li>
 *   <li>{@link PbxObjectRef}: 다른 {@link PbxObject} 참조 (소유하지 않음)</li>
 *   <li>{@link PbxObjectList}: 순서가 보존되는 노드 목록</li>
 *   <li>{@link PbxAttributeGroup}: 삽입 순서가 보존되는 이름 → 노드 묶음</li>
 *   <li>{@link PbxObject}: 식별자와 카테고리를 가진 객체</li>
 * </ul>
 *
 * <p>출력 규칙은 {@link #kind()}에 대한 분기로 결정됩니다.</p>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public sealed interface PbxNode
    permits PbxString, PbxObjectRef, PbxObjectList, PbxAttributeGroup, PbxObject {

    /**
     * 노드 종류.
     *
     * @return 종류 태그
     */
    NodeKind kind();

    /**
     * 빈 노드인지 확인.
     *
     * <ul>
     *   <li>목록: 원소 0개</li>
     *   <li>문자열: 길이 0</li>
     *   <li>속성 묶음: 속성 0개</li>
     *   <li>참조: 대상 없음</li>
     *   <li>객체: 식별자 없음</li>
     * </ul>
     *
     * @return 비어 있으면 true
     */
    boolean isEmpty();
}
