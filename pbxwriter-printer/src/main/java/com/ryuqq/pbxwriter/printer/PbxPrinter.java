package com.ryuqq.pbxwriter.printer;

import com.ryuqq.pbxwriter.core.model.PbxAttributeGroup;
import com.ryuqq.pbxwriter.core.model.PbxNode;
import com.ryuqq.pbxwriter.core.model.PbxObject;
import com.ryuqq.pbxwriter.core.model.PbxObjectList;
import com.ryuqq.pbxwriter.core.model.PbxObjectRef;
import com.ryuqq.pbxwriter.core.model.PbxString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

/**
 * PBX 객체 목록 출력기.
 *
 * <p>그래프를 한 번의 깊이 우선 순회로 텍스트로 변환합니다. 그래프는 읽기만 하며
 * 같은 그래프를 두 번 출력하면 바이트 단위로 같은 결과가 나옵니다.</p>
 *
 * <p><strong>출력 구조:</strong></p>
 * <pre>
 * 	objects = {
 * 		ID /* comment *&#47; = {
 * 			isa = PBXGroup;
 * 			name = foo;
 * 		};
 * 	};
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>출력할 수 없는 노드 종류 (속성 값으로 쓰인 객체 등): {@link IllegalStateException}</li>
 *   <li>식별자 없는 객체, 대상 없는 참조: {@link IllegalStateException}</li>
 *   <li>결과는 버퍼에 모두 만든 뒤 한 번에 쓰므로 실패 시 sink에는 아무것도 쓰지 않습니다.</li>
 * </ul>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public final class PbxPrinter {

    private static final Logger log = LoggerFactory.getLogger(PbxPrinter.class);

    /**
     * 이 이름의 참조 속성은 대상 주석을 출력하지 않습니다.
     */
    public static final String REMOTE_GLOBAL_ID_ATTRIBUTE = "remoteGlobalIDString";

    static final String LISTING_HEADER = "\tobjects = {\n";
    static final String LISTING_FOOTER = "\t};\n";

    private static final int OBJECT_LEVEL = 2;
    private static final int ATTRIBUTE_LEVEL = 3;

    private final PrinterConfig config;

    /**
     * 기본 설정으로 생성.
     */
    public PbxPrinter() {
        this(new PrinterConfig());
    }

    /**
     * 생성자.
     *
     * @param config printer 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public PbxPrinter(PrinterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    public PrinterConfig config() {
        return config;
    }

    /**
     * root 목록 전체를 출력해 sink에 기록.
     *
     * @param roots root 노드 목록 (객체가 아닌 노드는 건너뜀)
     * @param out 출력 sink
     * @throws IOException sink 쓰기 실패 시
     * @throws IllegalStateException 그래프가 출력 불변식을 위반한 경우
     */
    public void print(List<? extends PbxNode> roots, Writer out) throws IOException {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        String text = render(roots);
        out.write(text);
        out.flush();
    }

    /**
     * root 목록 전체를 문자열로 출력.
     *
     * <p>root 순서 그대로 출력하며 재정렬하지 않습니다.</p>
     *
     * @param roots root 노드 목록 (객체가 아닌 노드는 건너뜀)
     * @return {@code objects = { ... };} 블록
     * @throws IllegalStateException 그래프가 출력 불변식을 위반한 경우
     */
    public String render(List<? extends PbxNode> roots) {
        if (roots == null) {
            throw new IllegalArgumentException("roots cannot be null");
        }
        StringBuilder out = new StringBuilder();
        out.append(LISTING_HEADER);
        int printed = 0;
        for (PbxNode root : roots) {
            if (root instanceof PbxObject object) {
                appendObject(out, object);
                printed++;
            }
        }
        out.append(LISTING_FOOTER);
        log.debug("Rendered {} objects out of {} roots (formatVersion={})",
            printed, roots.size(), config.formatVersion());
        return out.toString();
    }

    /**
     * 객체 하나를 문자열로 출력.
     *
     * @param object 출력할 객체
     * @return 객체 블록 (마지막 줄바꿈 포함)
     * @throws IllegalStateException 객체가 출력 불변식을 위반한 경우
     */
    public String renderObject(PbxObject object) {
        if (object == null) {
            throw new IllegalArgumentException("object cannot be null");
        }
        StringBuilder out = new StringBuilder();
        appendObject(out, object);
        return out.toString();
    }

    private void appendObject(StringBuilder out, PbxObject object) {
        LayoutMode mode = LayoutMode.select(object.getType(), config);
        int factor = mode.indentFactor();
        String separator = mode.separator();

        // 객체 첫 줄은 레이아웃과 관계없이 들여쓴다
        indent(out, OBJECT_LEVEL);
        out.append(requireId(object));
        appendComment(out, object);
        out.append(" = {");
        if (mode.isExpanded()) {
            out.append(separator);
        }

        indent(out, ATTRIBUTE_LEVEL * factor);
        out.append(PbxObject.ISA).append(" = ").append(object.getType().pbxName()).append(';').append(separator);
        for (Map.Entry<String, PbxNode> attribute : object.attributes().entrySet()) {
            if (PbxObject.ISA.equals(attribute.getKey())) {
                continue;
            }
            appendAttribute(out, ATTRIBUTE_LEVEL, mode, attribute.getKey(), attribute.getValue(), false);
        }

        indent(out, OBJECT_LEVEL * factor);
        out.append("};\n");
    }

    private void appendAttribute(StringBuilder out, int level, LayoutMode mode,
                                 String name, PbxNode value, boolean insideGroup) {
        int factor = mode.indentFactor();
        String separator = mode.separator();

        indent(out, level * factor);
        switch (value.kind()) {
            case OBJECT_LIST -> {
                PbxObjectList list = (PbxObjectList) value;
                PbxStrings.appendEscaped(out, name);
                out.append(" = (");
                if (!insideGroup) {
                    out.append(separator);
                }
                List<PbxNode> elements = list.elements();
                for (int i = 0; i < elements.size(); i++) {
                    PbxNode element = elements.get(i);
                    if (element instanceof PbxString string) {
                        PbxStrings.appendEscaped(out, string.value());
                        if (i + 1 < elements.size()) {
                            out.append(',');
                        }
                    } else {
                        PbxObject target = listElementTarget(name, element);
                        indent(out, (level + 1) * factor);
                        out.append(requireId(target));
                        appendComment(out, target);
                        out.append(',').append(separator);
                    }
                }
                if (!insideGroup) {
                    indent(out, level * factor);
                }
                out.append(");").append(separator);
            }
            case ATTRIBUTE_GROUP -> {
                PbxAttributeGroup group = (PbxAttributeGroup) value;
                PbxStrings.appendEscaped(out, name);
                out.append(" = {");
                if (mode.isExpanded()) {
                    out.append(separator);
                }
                for (Map.Entry<String, PbxNode> attribute : group.attributes().entrySet()) {
                    appendAttribute(out, (level + 1) * factor, mode, attribute.getKey(), attribute.getValue(), true);
                }
                indent(out, level * factor);
                out.append("};").append(separator);
            }
            case OBJECT_REF -> {
                PbxObjectRef ref = (PbxObjectRef) value;
                PbxObject target = ref.getTarget();
                if (target == null) {
                    throw new IllegalStateException("Unresolved object reference in attribute '" + name + "'");
                }
                PbxStrings.appendEscaped(out, name);
                out.append(" = ").append(requireId(target));
                if (target.hasComment() && !REMOTE_GLOBAL_ID_ATTRIBUTE.equals(name)) {
                    appendComment(out, target);
                }
                out.append(';').append(separator);
            }
            case STRING -> {
                PbxStrings.appendEscaped(out, name);
                out.append(" = ");
                PbxStrings.appendEscaped(out, ((PbxString) value).value());
                out.append(';').append(separator);
            }
            default -> throw new IllegalStateException(
                "Attribute '" + name + "' holds a node of kind " + value.kind() + " which cannot be printed inline"
            );
        }
    }

    private static PbxObject listElementTarget(String name, PbxNode element) {
        if (element instanceof PbxObject object) {
            return object;
        }
        if (element instanceof PbxObjectRef ref) {
            if (ref.getTarget() == null) {
                throw new IllegalStateException("Unresolved object reference in list '" + name + "'");
            }
            return ref.getTarget();
        }
        throw new IllegalStateException(
            "List '" + name + "' holds a node of kind " + element.kind() + " which cannot be printed as an element"
        );
    }

    private static String requireId(PbxObject object) {
        if (object.isEmpty()) {
            throw new IllegalStateException("Object of type " + object.getType().pbxName() + " has no identifier");
        }
        return object.getId();
    }

    private static void appendComment(StringBuilder out, PbxObject object) {
        if (object.hasComment()) {
            out.append(" /* ").append(object.getComment()).append(" */");
        }
    }

    private static void indent(StringBuilder out, int level) {
        for (int i = 0; i < level; i++) {
            out.append('\t');
        }
    }
}
