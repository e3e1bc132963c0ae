/**
 * Project state model package.
 *
 * <p>This package contains the immutable value types handled by a
 * {@link com.ryuqq.statestore.core.spi.StateStore}.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statestore.core.model.ProjectState} - The payload: identity fields, class records, extensions</li>
 *   <li>{@link com.ryuqq.statestore.core.model.ClassRecord} - One analyzed class with its source file metadata</li>
 *   <li>{@link com.ryuqq.statestore.core.model.StateSnapshot} - Sequence-numbered, checksummed point-in-time copy</li>
 *   <li>{@link com.ryuqq.statestore.core.model.StateTransaction} - One logical operation and its pre-image</li>
 *   <li>{@link com.ryuqq.statestore.core.model.TransactionId} - Transaction identifier</li>
 * </ul>
 *
 * <h2>Copy Semantics</h2>
 * <p>JSON values held in extensions and attributes are deep-copied on the way in and on the way out,
 * so no caller can reach into a value the store keeps.</p>
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.core.model;
