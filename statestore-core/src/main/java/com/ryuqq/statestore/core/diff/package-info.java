/**
 * Structural diff between two {@link com.ryuqq.statestore.core.model.ProjectState} values.
 *
 * <p>Used to see what a pipeline step changed, e.g. by diffing a retained snapshot against the
 * live state with {@link com.ryuqq.statestore.core.spi.StateStore#diffAgainstSnapshot(long)}.</p>
 *
 * <h2>Example</h2>
 * <pre>
 * DiffReport report = StateDiffer.diff(before, after);
 * if (!report.identical()) {
 *     log.info("\n{}", report.format());
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.core.diff;
