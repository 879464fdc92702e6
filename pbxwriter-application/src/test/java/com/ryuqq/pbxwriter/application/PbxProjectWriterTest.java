package com.ryuqq.pbxwriter.application;

import com.ryuqq.pbxwriter.core.id.ObjectIdRegistry;
import com.ryuqq.pbxwriter.core.model.PbxAttributeGroup;
import com.ryuqq.pbxwriter.core.model.PbxGraph;
import com.ryuqq.pbxwriter.core.model.PbxObject;
import com.ryuqq.pbxwriter.core.model.PbxObjectList;
import com.ryuqq.pbxwriter.core.model.PbxString;
import com.ryuqq.pbxwriter.core.model.PbxType;
import com.ryuqq.pbxwriter.printer.PbxPrinter;
import com.ryuqq.pbxwriter.printer.PrinterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PbxProjectWriter 테스트.
 *
 * <p>작은 샘플 프로젝트(그룹, 파일, 타깃, 빌드 설정)를 만들어 파일 envelope과
 * 변경 시에만 쓰기 동작을 검증합니다.</p>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
class PbxProjectWriterTest {

    @TempDir
    Path tempDir;

    private PbxGraph graph;
    private PbxObject project;

    @BeforeEach
    void setUp() {
        graph = new PbxGraph(new ObjectIdRegistry());
        project = buildSampleProject(graph);
    }

    // ============================================================
    // 1. 파일 내용
    // ============================================================

    @Test
    void render_envelope_구조() {
        // given
        PbxProjectWriter writer = new PbxProjectWriter();
        String listing = new PbxPrinter().render(graph.objects());

        // when
        String text = writer.render(graph, project);

        // then
        assertThat(text).isEqualTo(
            "// !$*UTF8*$!\n"
                + "{\n"
                + "\tarchiveVersion = 1;\n"
                + "\tclasses = {\n"
                + "\t};\n"
                + "\tobjectVersion = 44;\n"
                + listing
                + "\trootObject = " + project.getId() + " /* Project object */;\n"
                + "}\n"
        );
    }

    @Test
    void render_새_포맷_버전은_objectVersion_46과_compact_레이아웃() {
        // given
        PbxProjectWriter writer = new PbxProjectWriter(
            new ProjectWriterConfig().withPrinterConfig(new PrinterConfig().withFormatVersion(50))
        );

        // when
        String text = writer.render(graph, project);

        // then
        assertThat(text).contains("\tobjectVersion = 46;\n");
        assertThat(text).contains("= {isa = PBXBuildFile; fileRef = ");
        assertThat(text).contains("\t\t\tisa = PBXProject;\n");
    }

    @Test
    void render_두_번_생성해도_같은_바이트() {
        // given
        PbxProjectWriter writer = new PbxProjectWriter();

        // when
        String first = writer.render(graph, project);
        String second = writer.render(graph, project);

        // then
        assertThat(second).isEqualTo(first);
    }

    @Test
    void render_같은_입력으로_새_그래프를_만들어도_같은_결과() {
        // given: 독립된 레지스트리로 동일한 그래프 재구성
        PbxGraph other = new PbxGraph(new ObjectIdRegistry());
        PbxObject otherProject = buildSampleProject(other);
        PbxProjectWriter writer = new PbxProjectWriter();

        // when & then
        assertThat(writer.render(other, otherProject)).isEqualTo(writer.render(graph, project));
    }

    @Test
    void render_root_객체는_그래프에_등록된_PBXProject여야_함() {
        // given
        PbxProjectWriter writer = new PbxProjectWriter();
        PbxObject file = graph.objects().get(0);
        PbxObject foreign = new PbxGraph(new ObjectIdRegistry()).createObject(PbxType.PROJECT, "foreign");

        // when & then
        assertThatThrownBy(() -> writer.render(graph, file))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("PBXProject");
        assertThatThrownBy(() -> writer.render(graph, foreign))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not registered");
    }

    @Test
    void write_writer_sink에_기록() throws Exception {
        // given
        PbxProjectWriter writer = new PbxProjectWriter();
        StringWriter out = new StringWriter();

        // when
        writer.write(graph, project, out);

        // then
        assertThat(out.toString()).isEqualTo(writer.render(graph, project));
    }

    // ============================================================
    // 2. 파일 쓰기
    // ============================================================

    @Test
    void write_상위_디렉터리를_만들고_UTF8로_기록() throws Exception {
        // given
        PbxProjectWriter writer = new PbxProjectWriter();
        Path path = tempDir.resolve("Sample.xcodeproj").resolve("project.pbxproj");

        // when
        boolean written = writer.write(graph, project, path);

        // then
        assertThat(written).isTrue();
        assertThat(Files.readString(path, StandardCharsets.UTF_8)).isEqualTo(writer.render(graph, project));
    }

    @Test
    void write_내용이_같으면_파일을_건드리지_않음() throws Exception {
        // given
        PbxProjectWriter writer = new PbxProjectWriter();
        Path path = tempDir.resolve("project.pbxproj");
        writer.write(graph, project, path);
        FileTime stamp = FileTime.fromMillis(1_000_000L);
        Files.setLastModifiedTime(path, stamp);

        // when
        boolean written = writer.write(graph, project, path);

        // then
        assertThat(written).isFalse();
        assertThat(Files.getLastModifiedTime(path)).isEqualTo(stamp);
    }

    @Test
    void write_내용이_바뀌면_다시_기록() throws Exception {
        // given
        PbxProjectWriter writer = new PbxProjectWriter();
        Path path = tempDir.resolve("project.pbxproj");
        writer.write(graph, project, path);
        project.setAttribute("developmentRegion", PbxString.of("en"));

        // when
        boolean written = writer.write(graph, project, path);

        // then
        assertThat(written).isTrue();
        assertThat(Files.readString(path)).contains("developmentRegion = en;");
    }

    @Test
    void write_기존_파일이_UTF8이_아니어도_덮어씀() throws Exception {
        // given
        PbxProjectWriter writer = new PbxProjectWriter();
        Path path = tempDir.resolve("project.pbxproj");
        Files.write(path, new byte[]{(byte) 0xC3, 0x28, 0x78});

        // when
        boolean written = writer.write(graph, project, path);

        // then
        assertThat(written).isTrue();
        assertThat(Files.readString(path, StandardCharsets.UTF_8)).isEqualTo(writer.render(graph, project));
    }

    @Test
    void write_항상_쓰기_설정이면_같은_내용도_기록() throws Exception {
        // given
        PbxProjectWriter writer = new PbxProjectWriter(new ProjectWriterConfig().withWriteOnlyIfChanged(false));
        Path path = tempDir.resolve("project.pbxproj");
        writer.write(graph, project, path);

        // when
        boolean written = writer.write(graph, project, path);

        // then
        assertThat(written).isTrue();
    }

    @Test
    void write_렌더링_실패_시_기존_파일_유지() throws Exception {
        // given
        PbxProjectWriter writer = new PbxProjectWriter();
        Path path = tempDir.resolve("project.pbxproj");
        writer.write(graph, project, path);
        String before = Files.readString(path);
        project.setAttribute("broken", graph.createObject(PbxType.GROUP, "nested"));

        // when & then
        assertThatThrownBy(() -> writer.write(graph, project, path))
            .isInstanceOf(IllegalStateException.class);
        assertThat(Files.readString(path)).isEqualTo(before);
    }

    private static PbxObject buildSampleProject(PbxGraph graph) {
        PbxObject mainC = graph.createObject(PbxType.FILE_REFERENCE, "/src/main.c");
        mainC.setComment("main.c");
        mainC.setAttribute("lastKnownFileType", PbxString.of("sourcecode.c.c"));
        mainC.setAttribute("path", PbxString.of("main.c"));
        mainC.setAttribute("sourceTree", PbxString.of("<group>"));

        PbxObject buildFile = graph.createObject(PbxType.BUILD_FILE, "");
        buildFile.setComment("main.c in Sources");
        buildFile.setAttribute("fileRef", graph.createRef(mainC));

        PbxObject mainGroup = graph.createObject(PbxType.GROUP, "main-group");
        mainGroup.setAttribute("children", PbxObjectList.of(mainC));
        mainGroup.setAttribute("sourceTree", PbxString.of("<group>"));

        PbxObject sources = graph.createObject(PbxType.SOURCES_BUILD_PHASE, "sources");
        sources.setComment("Sources");
        sources.setAttribute("buildActionMask", PbxString.of("2147483647"));
        sources.setAttribute("files", PbxObjectList.of(buildFile));

        PbxObject debug = graph.createObject(PbxType.BUILD_CONFIGURATION, "Debug");
        debug.setComment("Debug");
        PbxAttributeGroup settings = graph.createGroup();
        settings.setAttribute("PRODUCT_NAME", PbxString.of("Sample"));
        settings.setAttribute("HEADER_SEARCH_PATHS", PbxObjectList.of(PbxString.of("include"), PbxString.of("$(SRCROOT)/gen")));
        debug.setAttribute("buildSettings", settings);
        debug.setAttribute("name", PbxString.of("Debug"));

        PbxObject configurations = graph.createObject(PbxType.CONFIGURATION_LIST, "configs");
        configurations.setComment("Build configuration list for PBXProject \"Sample\"");
        configurations.setAttribute("buildConfigurations", PbxObjectList.of(debug));
        configurations.setAttribute("defaultConfigurationName", PbxString.of("Debug"));

        PbxObject target = graph.createObject(PbxType.NATIVE_TARGET, "target-sample");
        target.setComment("Sample");
        target.setAttribute("buildPhases", PbxObjectList.of(sources));
        target.setAttribute("name", PbxString.of("Sample"));

        PbxObject project = graph.createObject(PbxType.PROJECT, "project");
        project.setComment("Project object");
        project.setAttribute("buildConfigurationList", graph.createRef(configurations));
        project.setAttribute("mainGroup", graph.createRef(mainGroup));
        project.setAttribute("targets", PbxObjectList.of(target));
        return project;
    }
}
