package com.ryuqq.statestore.core.consistency;

import java.time.Instant;

/**
 * 상태와 파일 시스템 간 불일치 하나.
 *
 * @param type 불일치 유형
 * @param className 해당 클래스 이름 (프로젝트 디렉토리 문제면 null)
 * @param filePath 해당 파일 경로
 * @param recordedModified 상태에 기록된 수정 시각 (null 가능)
 * @param actualModified 디스크의 수정 시각 (null 가능)
 * @param message 사람이 읽을 수 있는 설명
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public record ConsistencyIssue(
    Type type,
    String className,
    String filePath,
    Instant recordedModified,
    Instant actualModified,
    String message
) {

    /**
     * 불일치 유형.
     */
    public enum Type {
        /** 프로젝트 디렉토리가 존재하지 않음 */
        MISSING_PROJECT,
        /** 파일이 존재하지 않음 */
        MISSING_FILE,
        /** 분석 이후 파일이 수정됨 */
        MODIFIED_FILE,
        /** 파일 메타데이터를 읽을 수 없음 */
        UNREADABLE_FILE
    }

    public ConsistencyIssue {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (filePath == null) {
            throw new IllegalArgumentException("filePath cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    static ConsistencyIssue missingProject(String projectPath) {
        return new ConsistencyIssue(Type.MISSING_PROJECT, null, projectPath, null, null,
            "Project directory does not exist: " + projectPath);
    }

    static ConsistencyIssue missing(String className, String filePath) {
        return new ConsistencyIssue(Type.MISSING_FILE, className, filePath, null, null,
            "Missing file: " + filePath + " (class " + className + ")");
    }

    static ConsistencyIssue modified(String className, String filePath, Instant recorded, Instant actual) {
        return new ConsistencyIssue(Type.MODIFIED_FILE, className, filePath, recorded, actual,
            "File modified since analysis: " + filePath + " (recorded " + recorded + ", on disk " + actual + ")");
    }

    static ConsistencyIssue unreadable(String className, String filePath, String reason) {
        return new ConsistencyIssue(Type.UNREADABLE_FILE, className, filePath, null, null,
            "Cannot read file metadata: " + filePath + " (" + reason + ")");
    }
}
