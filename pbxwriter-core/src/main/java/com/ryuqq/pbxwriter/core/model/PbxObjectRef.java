package com.ryuqq.pbxwriter.core.model;

/**
 * 다른 {@link PbxObject}에 대한 비소유 참조.
 *
 * <p>출력 시 대상 객체의 식별자(와 주석)만 사용합니다. 대상의 수명은 대상을 처음 등록한
 * 그래프가 관리하며, 참조는 대상을 따라가 출력하지 않으므로 상호 참조(cycle)가 있어도 안전합니다.</p>
 *
 * <p>대상 없이 생성한 뒤 나중에 {@link #resolve(PbxObject)}로 연결할 수 있습니다.
 * 연결되지 않은 참조를 출력하면 오류입니다.</p>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public final class PbxObjectRef implements PbxNode {

    private PbxObject target;

    private PbxObjectRef(PbxObject target) {
        this.target = target;
    }

    /**
     * 대상 객체를 가리키는 참조 생성.
     *
     * @param target 대상 객체
     * @return PbxObjectRef 인스턴스
     * @throws IllegalArgumentException target이 null인 경우
     */
    public static PbxObjectRef to(PbxObject target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        return new PbxObjectRef(target);
    }

    /**
     * 아직 대상이 정해지지 않은 참조 생성.
     *
     * @return 빈 PbxObjectRef 인스턴스
     */
    public static PbxObjectRef unresolved() {
        return new PbxObjectRef(null);
    }

    /**
     * 대상 객체 연결 (기존 대상은 교체).
     *
     * @param target 대상 객체
     * @throws IllegalArgumentException target이 null인 경우
     */
    public void resolve(PbxObject target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        this.target = target;
    }

    /**
     * 대상 객체 조회.
     *
     * @return 대상 객체, 연결되지 않았으면 null
     */
    public PbxObject getTarget() {
        return target;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OBJECT_REF;
    }

    @Override
    public boolean isEmpty() {
        return target == null;
    }

    @Override
    public String toString() {
        return "PbxObjectRef{" + (target == null ? "unresolved" : target.getId()) + '}';
    }
}
