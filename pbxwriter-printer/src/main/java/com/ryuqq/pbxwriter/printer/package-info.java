/**
 * Printer Layer - PBX 텍스트 출력.
 *
 * <p>이 패키지는 객체 그래프를 PBX 텍스트 포맷으로 변환하는 구성 요소를 포함합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pbxwriter.printer.PbxPrinter} - 객체 목록 출력기</li>
 *   <li>{@link com.ryuqq.pbxwriter.printer.PbxStrings} - 문자열 escape 규칙</li>
 *   <li>{@link com.ryuqq.pbxwriter.printer.LayoutMode} - expanded / compact 레이아웃</li>
 *   <li>{@link com.ryuqq.pbxwriter.printer.PrinterConfig} - 포맷 버전 설정</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * application (PbxProjectWriter)
 *   ↓ depends on
 * printer (PbxPrinter)
 *   ↓ depends on
 * core (PbxGraph, PbxObject, ObjectIdRegistry)
 * </pre>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
package com.ryuqq.pbxwriter.printer;
