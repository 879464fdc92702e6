package com.ryuqq.pbxwriter.application;

import com.ryuqq.pbxwriter.core.model.PbxGraph;
import com.ryuqq.pbxwriter.core.model.PbxObject;
import com.ryuqq.pbxwriter.core.model.PbxType;
import com.ryuqq.pbxwriter.printer.PbxPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * PBX 프로젝트 파일 writer.
 *
 * <p>{@link PbxPrinter}가 만든 객체 목록을 프로젝트 파일 envelope으로 감쌉니다:</p>
 * <pre>
 * // !$*UTF8*$!
 * {
 * 	archiveVersion = 1;
 * 	classes = {
 * 	};
 * 	objectVersion = 46;
 * 	objects = {
 * 		...
 * 	};
 * 	rootObject = ID /* Project object *&#47;;
 * }
 * </pre>
 *
 * <p><strong>파일 쓰기:</strong></p>
 * <ul>
 *   <li>UTF-8, 상위 디렉터리 자동 생성</li>
 *   <li>{@link ProjectWriterConfig#writeOnlyIfChanged()}이면 기존 내용과 같을 때 쓰지 않음</li>
 *   <li>렌더링이 끝난 뒤에만 파일을 열기 때문에 렌더링 실패 시 기존 파일은 그대로 남음</li>
 * </ul>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public final class PbxProjectWriter {

    private static final Logger log = LoggerFactory.getLogger(PbxProjectWriter.class);

    static final String FILE_HEADER = "// !$*UTF8*$!\n";
    static final String ROOT_OBJECT_COMMENT = "Project object";

    private final ProjectWriterConfig config;
    private final PbxPrinter printer;

    /**
     * 기본 설정으로 생성.
     */
    public PbxProjectWriter() {
        this(new ProjectWriterConfig());
    }

    /**
     * 생성자.
     *
     * @param config writer 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public PbxProjectWriter(ProjectWriterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.printer = new PbxPrinter(config.printerConfig());
    }

    /**
     * 프로젝트 파일 전체 내용 생성.
     *
     * @param graph 객체 그래프
     * @param rootObject 프로젝트 객체 (그래프에 등록된 PBXProject)
     * @return 파일 내용
     * @throws IllegalArgumentException graph 또는 rootObject가 유효하지 않은 경우
     * @throws IllegalStateException 그래프가 출력 불변식을 위반한 경우
     */
    public String render(PbxGraph graph, PbxObject rootObject) {
        validate(graph, rootObject);

        StringBuilder out = new StringBuilder();
        out.append(FILE_HEADER);
        out.append("{\n");
        out.append("\tarchiveVersion = 1;\n");
        out.append("\tclasses = {\n");
        out.append("\t};\n");
        out.append("\tobjectVersion = ").append(config.objectVersion()).append(";\n");
        out.append(printer.render(graph.objects()));
        out.append("\trootObject = ").append(rootObject.getId())
            .append(" /* ").append(ROOT_OBJECT_COMMENT).append(" */;\n");
        out.append("}\n");
        return out.toString();
    }

    /**
     * 프로젝트 파일 내용을 sink에 기록.
     *
     * @param graph 객체 그래프
     * @param rootObject 프로젝트 객체
     * @param out 출력 sink
     * @throws IOException sink 쓰기 실패 시
     */
    public void write(PbxGraph graph, PbxObject rootObject, Writer out) throws IOException {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        out.write(render(graph, rootObject));
        out.flush();
    }

    /**
     * 프로젝트 파일을 경로에 기록.
     *
     * @param graph 객체 그래프
     * @param rootObject 프로젝트 객체
     * @param path 대상 파일 (예: {@code App.xcodeproj/project.pbxproj})
     * @return 파일이 새로 쓰였으면 true, 내용이 같아 건너뛰었으면 false
     * @throws IOException 파일 읽기/쓰기 실패 시
     */
    public boolean write(PbxGraph graph, PbxObject rootObject, Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        byte[] content = render(graph, rootObject).getBytes(StandardCharsets.UTF_8);

        // 기존 파일은 인코딩과 무관하게 바이트 단위로 비교
        if (config.writeOnlyIfChanged() && Files.isRegularFile(path)) {
            if (Arrays.equals(Files.readAllBytes(path), content)) {
                log.info("Project file unchanged, skipping write: {}", path);
                return false;
            }
        }

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, content);
        log.info("Project file written: {} ({} objects)", path, graph.objects().size());
        return true;
    }

    private static void validate(PbxGraph graph, PbxObject rootObject) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (rootObject == null) {
            throw new IllegalArgumentException("rootObject cannot be null");
        }
        if (rootObject.getType() != PbxType.PROJECT) {
            throw new IllegalArgumentException(
                "rootObject must be a " + PbxType.PROJECT.pbxName() + " (current: " + rootObject.getType().pbxName() + ")"
            );
        }
        if (!graph.contains(rootObject)) {
            throw new IllegalArgumentException("rootObject is not registered in the graph: " + rootObject.getId());
        }
    }
}
