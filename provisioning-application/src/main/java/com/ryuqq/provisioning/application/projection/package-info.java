/**
 * 이벤트를 읽기 모델로 반영하는 projection 계층.
 *
 * <p>{@link com.ryuqq.provisioning.application.projection.ProjectionRouter}가 (stream_type, event_type)으로
 * 핸들러를 고르고 처리 결과를 이벤트 로그에 processed / failed로 기록합니다. 카탈로그에 없는
 * 이벤트 타입은 {@link com.ryuqq.provisioning.core.exception.UnhandledEventTypeException}으로 알립니다.</p>
 *
 * <p>{@link com.ryuqq.provisioning.application.projection.ProjectionRebuilder}는 읽기 모델을 비우고
 * 전체 로그를 sequence 순으로 재생합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.application.projection;
