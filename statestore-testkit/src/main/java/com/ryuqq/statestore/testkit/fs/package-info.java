/**
 * Filesystem doubles for StateStore tests.
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.testkit.fs;
