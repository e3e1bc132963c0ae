/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces that adapters implement to provide concrete
 * state storage and filesystem access.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statestore.core.spi.StateStore} - Transactional, snapshot-based project state store</li>
 *   <li>{@link com.ryuqq.statestore.core.spi.FileMetadataProvider} - Read-only file existence and mtime queries</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., statestore-adapter-inmemory) provide concrete implementations.
 * Every {@code StateStore} implementation is expected to pass the contract tests in statestore-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Explicit Instances:</strong> One store per project, passed to each pipeline stage; no global singleton</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.core.spi;
