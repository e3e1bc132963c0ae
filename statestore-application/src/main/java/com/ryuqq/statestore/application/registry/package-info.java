/**
 * 프로젝트별 StateStore 관리.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.statestore.application.registry.StateStoreRegistry}: 경로 → StateStore 매핑</li>
 *   <li>{@link com.ryuqq.statestore.application.registry.StateStoreFactory}: StateStore 생성 전략</li>
 * </ul>
 *
 * @author StateStore Team
 * @since 1.0.0
 */
package com.ryuqq.statestore.application.registry;
