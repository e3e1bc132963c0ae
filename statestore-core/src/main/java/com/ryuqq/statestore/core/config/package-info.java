/**
 * Store configuration passed at construction time.
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.core.config;
