package com.ryuqq.pbxwriter.core.model;

import com.ryuqq.pbxwriter.core.id.ObjectIdRegistry;

import java.util.Map;

/**
 * 식별자를 가진 PBX 객체.
 *
 * <p>최상위 목록({@code objects = { ... }})에 출력되는 유일한 노드 종류입니다.</p>
 *
 * <p><strong>식별자 발급:</strong></p>
 * <ul>
 *   <li>hashing key가 비어 있으면 sequence-addressed ({@code 01...})</li>
 *   <li>그 외에는 content-addressed ({@code 02...})</li>
 *   <li>구분자({@code -}) 제거, 최대 24자</li>
 * </ul>
 *
 * <p><strong>예약 속성 {@value #ISA}:</strong> 생성 시 placeholder로 등록되며 실제 출력 값은
 * {@link #getType()}의 이름 테이블에서 가져옵니다. 속성 API로 설정하거나 제거할 수 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PbxObject file = PbxObject.create(PbxType.FILE_REFERENCE, "main.c", registry);
 * file.setAttribute("path", PbxString.of("main.c"));
 * file.setComment("main.c");
 * </pre>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public final class PbxObject implements PbxNode {

    /**
     * 예약 속성 이름.
     */
    public static final String ISA = "isa";

    /**
     * {@value #ISA} 자리를 차지하는 placeholder.
     */
    public static final PbxString ISA_PLACEHOLDER = PbxString.of("");

    private static final String COMMENT_END = "*/";

    private final PbxType type;
    private final AttributeMap attributes = new AttributeMap();
    private String id;
    private String comment = "";

    private PbxObject(PbxType type, String id) {
        this.type = type;
        this.id = id;
        this.attributes.set(ISA, ISA_PLACEHOLDER);
    }

    /**
     * PbxObject 생성 (레지스트리에서 식별자 발급).
     *
     * @param type 카테고리
     * @param hashingKey 내용 기반 key (null 또는 빈 문자열이면 sequence 식별자 사용)
     * @param registry 식별자 레지스트리
     * @return PbxObject 인스턴스
     * @throws IllegalArgumentException type 또는 registry가 null인 경우
     */
    public static PbxObject create(PbxType type, String hashingKey, ObjectIdRegistry registry) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        return new PbxObject(type, ObjectIdRegistry.normalize(registry.idFor(hashingKey)));
    }

    /**
     * 외부에서 참조되는 고정 식별자로 교체.
     *
     * <p>생성 식별자와 같은 규칙으로 정규화합니다.</p>
     *
     * @param id 새 식별자
     * @throws IllegalArgumentException id가 null, 공백이거나 정규화 후 비는 경우
     */
    public void overrideId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        String normalized = ObjectIdRegistry.normalize(id);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("id cannot consist of separators only");
        }
        this.id = normalized;
    }

    public String getId() {
        return id;
    }

    public PbxType getType() {
        return type;
    }

    /**
     * 속성 설정 (덮어쓰기, 기존 위치 유지).
     *
     * @param name 속성 이름
     * @param value 속성 값
     * @throws IllegalArgumentException name 또는 value가 null이거나 name이 {@value #ISA}인 경우
     */
    public void setAttribute(String name, PbxNode value) {
        rejectReserved(name);
        attributes.set(name, value);
    }

    /**
     * 값이 비어 있지 않을 때만 속성 설정.
     *
     * @param name 속성 이름
     * @param value 속성 값
     * @return 설정되었으면 true
     * @throws IllegalArgumentException name이 null이거나 {@value #ISA}인 경우
     */
    public boolean setAttributeIfNotEmpty(String name, PbxNode value) {
        rejectReserved(name);
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

    /**
     * 속성 제거.
     *
     * @param name 속성 이름
     * @return 제거된 값, 없었으면 null
     * @throws IllegalArgumentException name이 null이거나 {@value #ISA}인 경우
     */
    public PbxNode removeAttribute(String name) {
        rejectReserved(name);
        return attributes.remove(name);
    }

    /**
     * 다른 객체의 속성 전체를 복사해 현재 속성을 대체.
     *
     * <p>값 노드는 공유됩니다 (얕은 복사). 카테고리, 식별자, 주석은 바뀌지 않습니다.</p>
     *
     * @param source 원본 객체
     * @throws IllegalArgumentException source가 null인 경우
     */
    public void copyAttributesFrom(PbxObject source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        attributes.replaceWith(source.attributes);
    }

    /**
     * 삽입 순서대로의 속성 (읽기 전용 view, {@value #ISA} placeholder 포함).
     *
     * @return 속성 map
     */
    public Map<String, PbxNode> attributes() {
        return attributes.view();
    }

    /**
     * 주석 설정.
     *
     * <p>출력 시 식별자 뒤에 {@code /* comment *}{@code /} 형태로 붙습니다.
     * 주석을 닫는 시퀀스({@code *}{@code /})가 들어 있으면 출력 구조가 깨지므로 거부합니다.</p>
     *
     * @param comment 주석 (null이면 제거)
     * @throws IllegalArgumentException comment에 주석 종료 시퀀스가 포함된 경우
     */
    public void setComment(String comment) {
        if (comment != null && comment.contains(COMMENT_END)) {
            throw new IllegalArgumentException("comment cannot contain '" + COMMENT_END + "'");
        }
        this.comment = comment == null ? "" : comment;
    }

    public String getComment() {
        return comment;
    }

    public boolean hasComment() {
        return !comment.isEmpty();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OBJECT;
    }

    @Override
    public boolean isEmpty() {
        return id == null || id.isEmpty();
    }

    @Override
    public String toString() {
        return "PbxObject{" + type.pbxName() + ", " + id + '}';
    }

    private static void rejectReserved(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (ISA.equals(name)) {
            throw new IllegalArgumentException("'" + ISA + "' is reserved and derived from the object type");
        }
    }
}
