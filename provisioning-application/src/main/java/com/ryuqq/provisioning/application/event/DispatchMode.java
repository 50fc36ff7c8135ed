package com.ryuqq.provisioning.application.event;

/**
 * append 이후 projection 반영 방식.
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum DispatchMode {

    /**
     * append 직후 호출자 스레드에서 router 실행 (read-your-writes projection).
     */
    SYNCHRONOUS,

    /**
     * append만 수행. 별도 catch-up dispatcher가 미처리 이벤트를 폴링하여 반영.
     */
    ASYNCHRONOUS
}
