package com.ryuqq.pbxwriter.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 순서가 보존되는 노드 목록.
 *
 * <p>원소는 추가된 순서 그대로 출력됩니다. 문자열 원소는 한 줄에 나열되고,
 * 객체(또는 참조) 원소는 식별자 단위로 한 줄씩 출력됩니다.</p>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public final class PbxObjectList implements PbxNode {

    private final List<PbxNode> elements = new ArrayList<>();

    /**
     * 빈 목록 생성.
     */
    public PbxObjectList() {
    }

    /**
     * 주어진 원소들로 목록 생성.
     *
     * @param nodes 초기 원소
     * @return PbxObjectList 인스턴스
     * @throws IllegalArgumentException 원소 중 null이 있는 경우
     */
    public static PbxObjectList of(PbxNode... nodes) {
        PbxObjectList list = new PbxObjectList();
        for (PbxNode node : nodes) {
            list.add(node);
        }
        return list;
    }

    /**
     * 원소를 끝에 추가.
     *
     * @param node 추가할 노드
     * @throws IllegalArgumentException node가 null인 경우
     */
    public void add(PbxNode node) {
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        elements.add(node);
    }

    /**
     * 같은 인스턴스가 없을 때만 끝에 추가.
     *
     * @param node 추가할 노드
     * @return 추가되었으면 true
     * @throws IllegalArgumentException node가 null인 경우
     */
    public boolean addIfAbsent(PbxNode node) {
        if (contains(node)) {
            return false;
        }
        add(node);
        return true;
    }

    /**
     * 같은 인스턴스 포함 여부 (identity 비교).
     *
     * @param node 찾을 노드
     * @return 포함되어 있으면 true
     */
    public boolean contains(PbxNode node) {
        for (PbxNode element : elements) {
            if (element == node) {
                return true;
            }
        }
        return false;
    }

    /**
     * 같은 인스턴스 제거 (identity 비교, 첫 번째 것만).
     *
     * @param node 제거할 노드
     * @return 제거되었으면 true
     */
    public boolean remove(PbxNode node) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == node) {
                elements.remove(i);
                return true;
            }
        }
        return false;
    }

    public PbxNode get(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    /**
     * 원소 목록 (읽기 전용 view).
     *
     * @return 원소 목록
     */
    public List<PbxNode> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OBJECT_LIST;
    }

    @Override
    public boolean isEmpty() {
        return elements.isEmpty();
    }
}
