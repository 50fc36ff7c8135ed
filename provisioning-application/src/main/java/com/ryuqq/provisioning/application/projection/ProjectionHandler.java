package com.ryuqq.provisioning.application.projection;

import com.ryuqq.provisioning.core.event.DomainEvent;
import com.ryuqq.provisioning.core.event.DomainEventType;

/**
 * 스트림 유형 하나에 대한 projection 핸들러.
 *
 * <p>핸들러는 이벤트 하나를 읽기 모델에 반영할 뿐 처리 상태(processed_at 등)는 다루지 않습니다.
 * 처리 상태 기록은 {@link ProjectionRouter}의 책임입니다.</p>
 *
 * <p>같은 이벤트를 두 번 적용해도 결과가 같아야 합니다 (rebuild, catch-up 재시도).</p>
 *
 * @param <T> 이 핸들러가 처리하는 이벤트 타입
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface ProjectionHandler<T extends DomainEventType> {

    /**
     * 이벤트 반영.
     *
     * @param event 저장된 이벤트
     * @param type 해석된 이벤트 타입
     * @throws IllegalStateException 선행 projection이 없는 등 반영할 수 없는 경우
     */
    void apply(DomainEvent event, T type);
}
