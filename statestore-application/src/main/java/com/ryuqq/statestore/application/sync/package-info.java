/**
 * 파일 시스템과 상태의 재동기화.
 *
 * @author StateStore Team
 * @since 1.0.0
 */
package com.ryuqq.statestore.application.sync;
