package com.ryuqq.statestore.application.sync;

import com.ryuqq.statestore.core.model.ProjectState;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 프로젝트 디렉터리를 분석하여 ProjectState를 만드는 외부 협력자.
 *
 * <p>소스 파일을 다시 읽어 클래스 기록(경로, 수정 시각 포함)을 채우는 책임을 가집니다.
 * StateSynchronizer는 결과를 검증 후 저장할 뿐 분석 방법에는 관여하지 않습니다.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProjectStateLoader {

    /**
     * 프로젝트 분석.
     *
     * @param projectPath 정규화된 프로젝트 절대 경로
     * @return 분석 결과
     * @throws IOException 디렉터리를 읽을 수 없는 경우
     */
    ProjectState load(Path projectPath) throws IOException;
}
