/**
 * Pure shape validation of {@link com.ryuqq.statestore.core.model.ProjectState}.
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.core.validation;
