/**
 * Application Layer - 프로젝트 파일 생성.
 *
 * <p>객체 그래프를 완전한 프로젝트 파일로 기록하는 진입점을 제공합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pbxwriter.application.PbxProjectWriter} - 파일 envelope 출력, 변경 시에만 쓰기</li>
 *   <li>{@link com.ryuqq.pbxwriter.application.ProjectWriterConfig} - writer 설정</li>
 * </ul>
 *
 * @author PBX Writer Team
 * @since 1.0.0
 */
package com.ryuqq.pbxwriter.application;
