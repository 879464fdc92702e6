package com.ryuqq.pbxwriter.core.model;

import com.ryuqq.pbxwriter.core.id.ObjectIdRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PBX 객체 그래프 생성 컨텍스트.
 *
 * <p>식별자 레지스트리를 보유하고, {@link #createObject(PbxType, String)}로 생성한 객체를
 * 선언 순서대로 root 목록에 등록합니다. root 목록 순서가 곧 출력 순서입니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 그래프 자체는 한 스레드에서만 사용해야 합니다.
 * 여러 스레드가 독립된 하위 트리를 만들 때는 {@link PbxObject#create}에 같은 레지스트리를
 * 넘기면 되고, 레지스트리는 내부적으로 동기화되어 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PbxGraph graph = new PbxGraph();
 *
 * PbxObject mainGroup = graph.createObject(PbxType.GROUP, "main-group");
 * mainGroup.setAttribute("children", graph.createList());
 * mainGroup.setAttribute("sourceTree", graph.createString("&lt;group&gt;"));
 *
 * PbxObject project = graph.createObject(PbxType.PROJECT, "");
 * project.setAttribute("mainGroup", graph.createRef(mainGroup));
 * </pre>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public final class PbxGraph {

    private final ObjectIdRegistry registry;
    private final List<PbxObject> objects = new ArrayList<>();

    /**
     * 프로세스 공유 레지스트리를 사용하는 그래프 생성.
     */
    public PbxGraph() {
        this(ObjectIdRegistry.shared());
    }

    /**
     * 지정한 레지스트리를 사용하는 그래프 생성.
     *
     * @param registry 식별자 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public PbxGraph(ObjectIdRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * 객체 생성 후 root 목록 끝에 등록.
     *
     * @param type 카테고리
     * @param hashingKey 내용 기반 key (빈 문자열이면 sequence 식별자)
     * @return 생성된 객체
     */
    public PbxObject createObject(PbxType type, String hashingKey) {
        PbxObject object = PbxObject.create(type, hashingKey, registry);
        objects.add(object);
        return object;
    }

    /**
     * 다른 곳에서 생성한 객체를 root 목록 끝에 등록.
     *
     * @param object 등록할 객체
     * @throws IllegalArgumentException object가 null이거나 이미 등록된 경우
     */
    public void addObject(PbxObject object) {
        if (object == null) {
            throw new IllegalArgumentException("object cannot be null");
        }
        if (contains(object)) {
            throw new IllegalArgumentException("object already registered: " + object.getId());
        }
        objects.add(object);
    }

    public PbxString createString(String value) {
        return PbxString.of(value);
    }

    public PbxObjectList createList() {
        return new PbxObjectList();
    }

    public PbxAttributeGroup createGroup() {
        return new PbxAttributeGroup();
    }

    public PbxObjectRef createRef(PbxObject target) {
        return PbxObjectRef.to(target);
    }

    /**
     * 등록 여부 (identity 비교).
     *
     * @param object 찾을 객체
     * @return 등록되어 있으면 true
     */
    public boolean contains(PbxObject object) {
        for (PbxObject registered : objects) {
            if (registered == object) {
                return true;
            }
        }
        return false;
    }

    /**
     * 식별자로 등록된 객체 조회.
     *
     * @param id 식별자
     * @return 객체, 없으면 null
     */
    public PbxObject findById(String id) {
        for (PbxObject object : objects) {
            if (object.getId().equals(id)) {
                return object;
            }
        }
        return null;
    }

    /**
     * root 목록 (선언 순서, 읽기 전용 view).
     *
     * @return 등록된 객체 목록
     */
    public List<PbxObject> objects() {
        return Collections.unmodifiableList(objects);
    }

    public ObjectIdRegistry registry() {
        return registry;
    }

    /**
     * 새 생성 작업 준비: root 목록을 비우고 sequence 카운터를 초기화.
     *
     * <p>content 식별자 캐시는 유지됩니다.</p>
     */
    public void clear() {
        objects.clear();
        registry.resetSequence();
    }
}
