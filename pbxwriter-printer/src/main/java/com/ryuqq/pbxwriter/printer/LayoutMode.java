package com.ryuqq.pbxwriter.printer;

import com.ryuqq.pbxwriter.core.model.PbxType;

/**
 * 객체 단위 출력 레이아웃.
 *
 * <ul>
 *   <li>{@link #EXPANDED}: 속성마다 줄바꿈, 레벨당 탭 1개</li>
 *   <li>{@link #COMPACT}: 속성 사이 공백 1개, 들여쓰기 없음</li>
 * </ul>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
public enum LayoutMode {

    EXPANDED("\n", 1),
    COMPACT(" ", 0);

    private final String separator;
    private final int indentFactor;

    LayoutMode(String separator, int indentFactor) {
        this.separator = separator;
        this.indentFactor = indentFactor;
    }

    /**
     * 속성 줄 뒤에 붙는 구분자.
     *
     * @return 줄바꿈 또는 공백
     */
    public String separator() {
        return separator;
    }

    /**
     * 들여쓰기 레벨에 곱하는 계수.
     *
     * @return 1 (expanded) 또는 0 (compact)
     */
    public int indentFactor() {
        return indentFactor;
    }

    public boolean isExpanded() {
        return this == EXPANDED;
    }

    /**
     * 객체 카테고리와 설정으로 레이아웃 선택.
     *
     * @param type 객체 카테고리
     * @param config printer 설정
     * @return 선택된 레이아웃
     */
    public static LayoutMode select(PbxType type, PrinterConfig config) {
        if (config.allowsCompactLayout() && type.supportsCompactLayout()) {
            return COMPACT;
        }
        return EXPANDED;
    }
}
