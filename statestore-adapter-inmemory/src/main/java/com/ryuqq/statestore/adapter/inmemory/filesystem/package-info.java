/**
 * Local filesystem access for consistency verification.
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.adapter.inmemory.filesystem;
