/**
 * 부트스트랩 요청 모델.
 *
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.core.model.BootstrapId} - saga 식별자</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.BootstrapRequest} - 조직, 초대 대상, 서브도메인, 요청자</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.OrganizationParams} - 조직 이름, 유형, 연락처 정보</li>
 *   <li>{@link com.ryuqq.provisioning.core.model.InvitationRecipient} - 초대 대상 사용자</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Provisioning Team
 */
package com.ryuqq.provisioning.core.model;
