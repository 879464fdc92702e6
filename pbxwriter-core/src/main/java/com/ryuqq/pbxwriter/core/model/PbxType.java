package com.ryuqq.pbxwriter.core.model;

/**
 * PBX 객체 카테고리 (isa).
 *
 * <p>출력 시 {@link #pbxName()}으로 정해진 이름 테이블 값을 그대로 사용합니다.
 * 선언 순서와 이름 문자열은 출력 포맷 계약이므로 변경하면 안 됩니다.</p>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public enum PbxType {

    GROUP("PBXGroup"),
    BUILD_STYLE("PBXBuildStyle"),
    PROJECT("PBXProject"),
    HEADERS_BUILD_PHASE("PBXHeadersBuildPhase"),
    SOURCES_BUILD_PHASE("PBXSourcesBuildPhase"),
    FRAMEWORKS_BUILD_PHASE("PBXFrameworksBuildPhase"),
    NATIVE_TARGET("PBXNativeTarget"),
    FILE_REFERENCE("PBXFileReference"),
    BUILD_FILE("PBXBuildFile"),
    CONTAINER_ITEM_PROXY("PBXContainerItemProxy"),
    TARGET_DEPENDENCY("PBXTargetDependency"),
    SHELL_SCRIPT_BUILD_PHASE("PBXShellScriptBuildPhase"),
    RESOURCES_BUILD_PHASE("PBXResourcesBuildPhase"),
    APPLICATION_REFERENCE("PBXApplicationReference"),
    EXECUTABLE_FILE_REFERENCE("PBXExecutableFileReference"),
    LIBRARY_REFERENCE("PBXLibraryReference"),
    TOOL_TARGET("PBXToolTarget"),
    LIBRARY_TARGET("PBXLibraryTarget"),
    AGGREGATE_TARGET("PBXAggregateTarget"),
    BUILD_CONFIGURATION("XCBuildConfiguration"),
    CONFIGURATION_LIST("XCConfigurationList"),
    COPY_FILES_BUILD_PHASE("PBXCopyFilesBuildPhase"),

    /**
     * 알 수 없는 카테고리 (sentinel).
     */
    NONE("None");

    private final String pbxName;

    PbxType(String pbxName) {
        this.pbxName = pbxName;
    }

    /**
     * 출력용 정식 이름.
     *
     * @return 예: {@code PBXGroup}
     */
    public String pbxName() {
        return pbxName;
    }

    /**
     * 한 줄(compact) 레이아웃 대상 카테고리인지 확인.
     *
     * <p>파일 참조와 빌드 파일 항목은 개수가 많아 새 포맷 버전에서 한 줄로 출력됩니다.</p>
     *
     * @return PBXFileReference 또는 PBXBuildFile인 경우 true
     */
    public boolean supportsCompactLayout() {
        return this == FILE_REFERENCE || this == BUILD_FILE;
    }
}
