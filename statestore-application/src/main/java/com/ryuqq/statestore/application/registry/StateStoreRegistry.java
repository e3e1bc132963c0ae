package com.ryuqq.statestore.application.registry;

import com.ryuqq.statestore.core.config.StateStoreConfig;
import com.ryuqq.statestore.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로젝트 경로별 StateStore 레지스트리.
 *
 * <p>StateStore 인스턴스 하나는 프로젝트 하나의 상태만 보관합니다. 여러 프로젝트를
 * 동시에 다루는 호출자는 이 레지스트리를 통해 프로젝트별 인스턴스를 얻습니다.</p>
 *
 * <p><strong>경로 정규화:</strong> 키는 {@code toAbsolutePath().normalize()} 결과이므로
 * {@code /work/demo}와 {@code /work/demo/../demo}는 같은 StateStore를 가리킵니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> {@link ConcurrentHashMap#computeIfAbsent}로
 * 프로젝트당 정확히 하나의 인스턴스만 생성됩니다.</p>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
public class StateStoreRegistry {

    private static final Logger log = LoggerFactory.getLogger(StateStoreRegistry.class);

    private final ConcurrentHashMap<Path, StateStore> stores = new ConcurrentHashMap<>();
    private final StateStoreConfig config;
    private final StateStoreFactory factory;

    /**
     * 생성자.
     *
     * @param config 모든 StateStore가 공유하는 설정
     * @param factory StateStore 생성기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public StateStoreRegistry(StateStoreConfig config, StateStoreFactory factory) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        this.config = config;
        this.factory = factory;
    }

    /**
     * 프로젝트의 StateStore 조회 (없으면 생성).
     *
     * @param projectPath 프로젝트 경로
     * @return 해당 프로젝트의 StateStore
     * @throws IllegalStateException factory가 null을 반환한 경우
     */
    public StateStore storeFor(Path projectPath) {
        Path key = normalize(projectPath);
        return stores.computeIfAbsent(key, path -> {
            StateStore store = factory.create(path, config);
            if (store == null) {
                throw new IllegalStateException("StateStoreFactory returned null for " + path);
            }
            log.debug("Created state store for {}", path);
            return store;
        });
    }

    /**
     * 이미 생성된 StateStore 조회.
     *
     * @param projectPath 프로젝트 경로
     * @return StateStore (없으면 empty)
     */
    public Optional<StateStore> find(Path projectPath) {
        return Optional.ofNullable(stores.get(normalize(projectPath)));
    }

    /**
     * StateStore 해제.
     *
     * <p>상태와 이력을 모두 비운 뒤 레지스트리에서 제거합니다.</p>
     *
     * @param projectPath 프로젝트 경로
     * @return 해제된 StateStore가 있었으면 true
     */
    public boolean release(Path projectPath) {
        StateStore removed = stores.remove(normalize(projectPath));
        if (removed == null) {
            return false;
        }
        removed.clearState();
        log.info("Released state store for {}", normalize(projectPath));
        return true;
    }

    /**
     * @return 등록된 프로젝트 경로 (정렬된 복사본)
     */
    public Set<Path> projects() {
        return new TreeSet<>(stores.keySet());
    }

    public StateStoreConfig config() {
        return config;
    }

    private static Path normalize(Path projectPath) {
        if (projectPath == null) {
            throw new IllegalArgumentException("projectPath cannot be null");
        }
        return projectPath.toAbsolutePath().normalize();
    }
}
