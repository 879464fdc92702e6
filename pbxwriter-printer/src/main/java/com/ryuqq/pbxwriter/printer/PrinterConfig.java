package com.ryuqq.pbxwriter.printer;

/**
 * Printer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>formatVersion: 출력 대상 포맷 버전 (기본 15)</li>
 *   <li>compactThreshold: 이 값을 초과하는 버전에서 compact 레이아웃 허용 (기본 15)</li>
 * </ul>
 *
 * <p>compact 레이아웃은 {@code formatVersion > compactThreshold}이고 객체 카테고리가
 * compact 대상(파일 참조, 빌드 파일)일 때만 적용됩니다.</p>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 * @param formatVersion 포맷 버전 (양수여야 함)
 * @param compactThreshold compact 레이아웃 기준 버전 (0 이상이어야 함)
 */
public record PrinterConfig(int formatVersion, int compactThreshold) {

    /**
     * 기본 포맷 버전.
     */
    public static final int DEFAULT_FORMAT_VERSION = 15;

    /**
     * 기본 compact 기준 버전.
     */
    public static final int DEFAULT_COMPACT_THRESHOLD = 15;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: formatVersion=15, compactThreshold=15 (compact 레이아웃 없음)</p>
     */
    public PrinterConfig() {
        this(DEFAULT_FORMAT_VERSION, DEFAULT_COMPACT_THRESHOLD);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PrinterConfig {
        if (formatVersion <= 0) {
            throw new IllegalArgumentException(
                "formatVersion must be positive (current: " + formatVersion + ")"
            );
        }
        if (compactThreshold < 0) {
            throw new IllegalArgumentException(
                "compactThreshold must be non-negative (current: " + compactThreshold + ")"
            );
        }
    }

    /**
     * formatVersion만 변경한 새 인스턴스 생성.
     *
     * @param formatVersion 새 포맷 버전
     * @return 새 PrinterConfig 인스턴스
     */
    public PrinterConfig withFormatVersion(int formatVersion) {
        return new PrinterConfig(formatVersion, this.compactThreshold);
    }

    /**
     * compactThreshold만 변경한 새 인스턴스 생성.
     *
     * @param compactThreshold 새 기준 버전
     * @return 새 PrinterConfig 인스턴스
     */
    public PrinterConfig withCompactThreshold(int compactThreshold) {
        return new PrinterConfig(this.formatVersion, compactThreshold);
    }

    /**
     * 현재 버전에서 compact 레이아웃이 허용되는지 확인.
     *
     * @return formatVersion이 compactThreshold보다 크면 true
     */
    public boolean allowsCompactLayout() {
        return formatVersion > compactThreshold;
    }
}
