package com.ryuqq.statestore.application.registry;

import com.ryuqq.statestore.core.config.StateStoreConfig;
import com.ryuqq.statestore.core.spi.StateStore;

import java.nio.file.Path;

/**
 * 프로젝트별 StateStore 생성기.
 *
 * <p>StateStoreRegistry가 처음 보는 프로젝트에 대해 한 번 호출합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StateStoreRegistry registry = new StateStoreRegistry(
 *     new StateStoreConfig(),
 *     (projectPath, config) -&gt; new InMemoryStateStore(config)
 * );
 * </pre>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateStoreFactory {

    /**
     * StateStore 생성.
     *
     * @param projectPath 정규화된 프로젝트 절대 경로
     * @param config 공유 설정
     * @return 비어 있는 새 StateStore
     */
    StateStore create(Path projectPath, StateStoreConfig config);
}
