package com.ryuqq.statestore.core.validation;

import com.ryuqq.statestore.core.model.ClassRecord;
import com.ryuqq.statestore.core.model.ProjectState;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * ProjectState 형태 검증기.
 *
 * <p>부수 효과가 없는 순수 검증이며, 위반 사항을 사람이 읽을 수 있는 문자열 목록으로 반환합니다.
 * 빈 목록은 유효함을 의미합니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>project_path: 비어 있지 않은 절대 경로</li>
 *   <li>project_name: 비어 있지 않음</li>
 *   <li>classes[i].name: 비어 있지 않음</li>
 *   <li>classes[i].file_path: 지정된 경우 공백 문자열 불가</li>
 * </ul>
 *
 * <p>파일 존재 여부는 검증하지 않습니다 (일관성 검증의 책임).</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class StateValidator {

    /**
     * 상태 검증.
     *
     * @param state 검증할 상태
     * @return 위반 사항 목록 (유효하면 빈 목록)
     */
    public List<String> validate(ProjectState state) {
        List<String> violations = new ArrayList<>();
        if (state == null) {
            violations.add("state cannot be null");
            return violations;
        }

        validateProjectPath(state.projectPath(), violations);

        if (isBlank(state.projectName())) {
            violations.add("project_name must not be empty");
        }

        List<ClassRecord> classes = state.classes();
        for (int i = 0; i < classes.size(); i++) {
            ClassRecord record = classes.get(i);
            if (isBlank(record.name())) {
                violations.add(String.format("classes[%d].name must not be empty", i));
            }
            if (record.hasFilePath() && record.filePath().isBlank()) {
                violations.add(String.format("classes[%d].file_path must not be blank when present", i));
            }
        }
        return violations;
    }

    /**
     * 상태가 유효한지 확인.
     *
     * @param state 검증할 상태
     * @return 위반 사항이 없으면 true
     */
    public boolean isValid(ProjectState state) {
        return validate(state).isEmpty();
    }

    private static void validateProjectPath(String projectPath, List<String> violations) {
        if (isBlank(projectPath)) {
            violations.add("project_path must not be empty");
            return;
        }
        try {
            if (!Path.of(projectPath).isAbsolute()) {
                violations.add("project_path must be an absolute path: " + projectPath);
            }
        } catch (InvalidPathException e) {
            violations.add("project_path is not a valid path: " + projectPath);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
