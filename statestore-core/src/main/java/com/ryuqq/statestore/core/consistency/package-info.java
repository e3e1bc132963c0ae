/**
 * Consistency verification of recorded class metadata against the filesystem.
 *
 * <p>Verification is read-only and never touches the live state. Filesystem access goes through the
 * {@link com.ryuqq.statestore.core.spi.FileMetadataProvider} SPI and happens outside the store lock.</p>
 *
 * @since 1.0.0
 * @author StateStore Team
 */
package com.ryuqq.statestore.core.consistency;
