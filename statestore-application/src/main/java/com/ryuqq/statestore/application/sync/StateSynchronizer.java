package com.ryuqq.statestore.application.sync;

import com.ryuqq.statestore.application.registry.StateStoreRegistry;
import com.ryuqq.statestore.core.consistency.ConsistencyReport;
import com.ryuqq.statestore.core.diff.DiffReport;
import com.ryuqq.statestore.core.diff.StateDiffer;
import com.ryuqq.statestore.core.exception.StateValidationException;
import com.ryuqq.statestore.core.model.ProjectState;
import com.ryuqq.statestore.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 파일 시스템 기준 상태 재동기화.
 *
 * <p>프로젝트를 다시 분석하여 StateStore의 상태를 교체합니다. 분석과 저장은
 * {@code executeWithRollback("sync_with_filesystem", ...)} 안에서 실행되므로,
 * 분석이 실패하거나 결과가 검증을 통과하지 못하면 기존 상태가 그대로 유지됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <pre>
 * sync(path):
 *   1. registry.storeFor(path)
 *   2. executeWithRollback("sync_with_filesystem"):
 *        loaded = loader.load(path)   → null이면 StateValidationException
 *        store.setState(loaded)
 *   3. 이전 상태가 있었으면 diff 계산
 *
 * syncIfStale(path):
 *   상태 없음          → sync(path)
 *   verify 결과 일관됨 → 다시 읽지 않음
 *   불일치 발견        → sync(path)
 * </pre>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class StateSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(StateSynchronizer.class);

    static final String OPERATION_NAME = "sync_with_filesystem";

    private final StateStoreRegistry registry;
    private final ProjectStateLoader loader;

    /**
     * 생성자.
     *
     * @param registry StateStore 레지스트리
     * @param loader 프로젝트 분석기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StateSynchronizer(StateStoreRegistry registry, ProjectStateLoader loader) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }
        this.registry = registry;
        this.loader = loader;
    }

    /**
     * 무조건 다시 읽어 상태 교체.
     *
     * @param projectPath 프로젝트 경로
     * @return 동기화 결과 (reloaded=true)
     * @throws IOException 분석 실패 (상태는 롤백됨)
     * @throws StateValidationException 분석 결과가 없거나 유효하지 않은 경우 (상태는 롤백됨)
     */
    public SyncResult sync(Path projectPath) throws IOException {
        return reload(projectPath, null);
    }

    /**
     * 파일 시스템과 불일치할 때만 다시 읽기.
     *
     * @param projectPath 프로젝트 경로
     * @return 동기화 결과
     * @throws IOException 분석 실패 (상태는 롤백됨)
     */
    public SyncResult syncIfStale(Path projectPath) throws IOException {
        StateStore store = registry.storeFor(projectPath);
        if (!store.hasState()) {
            log.debug("No state for {}, loading from filesystem", projectPath);
            return reload(projectPath, null);
        }

        ConsistencyReport consistency = store.verifyStateConsistency();
        if (consistency.consistent()) {
            log.debug("State of {} is up to date", projectPath);
            return SyncResult.upToDate(consistency);
        }

        log.info("State of {} is stale ({} issues), reloading", projectPath, consistency.issues().size());
        return reload(projectPath, consistency);
    }

    private SyncResult reload(Path projectPath, ConsistencyReport consistency) throws IOException {
        StateStore store = registry.storeFor(projectPath);
        Path normalized = projectPath.toAbsolutePath().normalize();

        ProjectState previous = store.hasState() ? store.getState() : null;
        ProjectState loaded = store.executeWithRollback(OPERATION_NAME, () -> {
            ProjectState state = loader.load(normalized);
            if (state == null) {
                throw new StateValidationException(List.of("project state loader returned no state for " + normalized));
            }
            store.setState(state);
            return state;
        }, e -> log.warn("Synchronization of {} failed: {}", normalized, e.toString()));

        DiffReport diff = previous == null ? null : StateDiffer.diff(previous, loaded);
        if (diff != null) {
            log.info("Synchronized {}: {} changes", normalized, diff.changes().size());
        }
        return new SyncResult(true, consistency, diff);
    }
}
