package com.ryuqq.pbxwriter.application;

import com.ryuqq.pbxwriter.printer.PrinterConfig;

/**
 * 프로젝트 파일 writer 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>printerConfig: 객체 목록 출력 설정 (포맷 버전)</li>
 *   <li>writeOnlyIfChanged: 내용이 같으면 파일을 건드리지 않음 (기본 true)</li>
 * </ul>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 * @param printerConfig printer 설정 (null 불가)
 * @param writeOnlyIfChanged 변경 시에만 쓰기 여부
 */
public record ProjectWriterConfig(PrinterConfig printerConfig, boolean writeOnlyIfChanged) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: printerConfig=기본 PrinterConfig, writeOnlyIfChanged=true</p>
     */
    public ProjectWriterConfig() {
        this(new PrinterConfig(), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException printerConfig가 null인 경우
     */
    public ProjectWriterConfig {
        if (printerConfig == null) {
            throw new IllegalArgumentException("printerConfig cannot be null");
        }
    }

    /**
     * printerConfig만 변경한 새 인스턴스 생성.
     *
     * @param printerConfig 새 printer 설정
     * @return 새 ProjectWriterConfig 인스턴스
     */
    public ProjectWriterConfig withPrinterConfig(PrinterConfig printerConfig) {
        return new ProjectWriterConfig(printerConfig, this.writeOnlyIfChanged);
    }

    /**
     * writeOnlyIfChanged만 변경한 새 인스턴스 생성.
     *
     * @param writeOnlyIfChanged 새 값
     * @return 새 ProjectWriterConfig 인스턴스
     */
    public ProjectWriterConfig withWriteOnlyIfChanged(boolean writeOnlyIfChanged) {
        return new ProjectWriterConfig(this.printerConfig, writeOnlyIfChanged);
    }

    /**
     * 포맷 버전에 대응하는 objectVersion 값.
     *
     * @return 50 이상 46, 32 이상 45, 그 외 44
     */
    public int objectVersion() {
        int formatVersion = printerConfig.formatVersion();
        if (formatVersion >= 50) {
            return 46;
        }
        if (formatVersion >= 32) {
            return 45;
        }
        return 44;
    }
}
