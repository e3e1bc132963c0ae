package com.ryuqq.statestore.core.consistency;

import com.ryuqq.statestore.core.model.ClassRecord;
import com.ryuqq.statestore.core.model.ProjectState;
import com.ryuqq.statestore.core.spi.FileMetadata;
import com.ryuqq.statestore.core.spi.FileMetadataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 프로젝트 상태와 파일 시스템 비교.
 *
 * <p>StateStore의 락 밖에서 호출되어야 합니다. 호출자는 검사할 상태를
 * 락 안에서 꺼낸 뒤 이 클래스에 넘깁니다.</p>
 *
 * <p><strong>검사 규칙:</strong></p>
 * <ul>
 *   <li>프로젝트 디렉토리 없음: MISSING_PROJECT 하나만 보고하고 클래스 검사는 생략</li>
 *   <li>filePath 없는 기록: 건너뜀</li>
 *   <li>파일 없음: MISSING_FILE</li>
 *   <li>lastModified가 기록되어 있고 디스크 값과 허용 오차 이상 차이남: MODIFIED_FILE</li>
 *   <li>메타데이터 조회 실패: UNREADABLE_FILE (예외를 던지지 않음)</li>
 * </ul>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public final class ConsistencyVerifier {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyVerifier.class);

    private final FileMetadataProvider files;
    private final Duration tolerance;

    /**
     * 생성자.
     *
     * @param files 파일 메타데이터 제공자
     * @param tolerance 수정 시각 허용 오차
     * @throws IllegalArgumentException 인자가 null이거나 tolerance가 음수인 경우
     */
    public ConsistencyVerifier(FileMetadataProvider files, Duration tolerance) {
        if (files == null) {
            throw new IllegalArgumentException("files cannot be null");
        }
        if (tolerance == null || tolerance.isNegative()) {
            throw new IllegalArgumentException("tolerance cannot be null or negative");
        }
        this.files = files;
        this.tolerance = tolerance;
    }

    /**
     * 프로젝트 디렉토리와 클래스 기록 검증.
     *
     * @param state 검사할 상태 (projectPath가 비어 있으면 디렉토리 검사 생략)
     * @return 검증 결과
     */
    public ConsistencyReport verify(ProjectState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }

        List<ConsistencyIssue> issues = new ArrayList<>();
        String projectPath = state.projectPath();
        if (projectPath != null && !projectPath.isBlank()) {
            ConsistencyIssue projectIssue = checkProject(projectPath);
            if (projectIssue != null && projectIssue.type() == ConsistencyIssue.Type.MISSING_PROJECT) {
                log.info("Project directory does not exist: {}", projectPath);
                return ConsistencyReport.of(List.of(projectIssue));
            }
            if (projectIssue != null) {
                issues.add(projectIssue);
            }
        }

        int checked = 0;
        for (ClassRecord record : state.classes()) {
            if (!record.hasFilePath()) {
                continue;
            }
            checked++;
            ConsistencyIssue issue = check(record);
            if (issue != null) {
                issues.add(issue);
            }
        }

        if (issues.isEmpty()) {
            log.debug("Consistency check passed: {} files checked", checked);
        } else {
            log.info("Consistency check found {} issues in {} files", issues.size(), checked);
        }
        return ConsistencyReport.of(issues);
    }

    private ConsistencyIssue checkProject(String projectPath) {
        try {
            return files.stat(projectPath).exists() ? null : ConsistencyIssue.missingProject(projectPath);
        } catch (IOException e) {
            log.warn("Failed to read metadata of project directory {}", projectPath, e);
            return ConsistencyIssue.unreadable(null, projectPath, e.getMessage());
        }
    }

    private ConsistencyIssue check(ClassRecord record) {
        FileMetadata metadata;
        try {
            metadata = files.stat(record.filePath());
        } catch (IOException e) {
            log.warn("Failed to read metadata of {}", record.filePath(), e);
            return ConsistencyIssue.unreadable(record.name(), record.filePath(), e.getMessage());
        }

        if (!metadata.exists()) {
            return ConsistencyIssue.missing(record.name(), record.filePath());
        }

        Instant recorded = record.lastModified();
        if (recorded != null && exceedsTolerance(recorded, metadata.lastModified())) {
            return ConsistencyIssue.modified(record.name(), record.filePath(), recorded, metadata.lastModified());
        }
        return null;
    }

    private boolean exceedsTolerance(Instant recorded, Instant actual) {
        return Duration.between(recorded, actual).abs().compareTo(tolerance) > 0;
    }
}
