/**
 * 이벤트 로그 모델.
 *
 * <p>모든 상태 변경은 스트림 단위의 append-only 이벤트로 기록됩니다. 스트림은
 * ({@link com.ryuqq.provisioning.core.event.StreamType}, stream id) 쌍으로 식별되며
 * 버전은 1부터 빈틈없이 증가합니다.</p>
 *
 * <h2>이벤트 카탈로그</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.core.event.OrganizationEventType} - 조직 생명주기와 서브도메인</li>
 *   <li>{@link com.ryuqq.provisioning.core.event.InvitationEventType} - 초대와 메일 발송</li>
 *   <li>{@link com.ryuqq.provisioning.core.event.ContactEventType},
 *       {@link com.ryuqq.provisioning.core.event.AddressEventType},
 *       {@link com.ryuqq.provisioning.core.event.PhoneEventType} - 연락처 정보</li>
 *   <li>{@link com.ryuqq.provisioning.core.event.JunctionEventType} - 조직과 연락처 정보의 연결</li>
 *   <li>{@link com.ryuqq.provisioning.core.event.BootstrapEventType} - saga 감사 기록</li>
 * </ul>
 *
 * <h2>저장 형식</h2>
 * <p>{@link com.ryuqq.provisioning.core.event.EventSerializer}가 Jackson으로 snake_case JSON
 * 행을 만듭니다. event_data와 event_metadata는 JSON 객체입니다.</p>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.event;
