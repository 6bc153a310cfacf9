package com.example.frontdesk.domain.enums;

/**
 * Help request 상태
 * <ul>
 *     <li>PENDING  : 감독자 답변 대기</li>
 *     <li>RESOLVED : 답변 완료 (terminal)</li>
 *     <li>TIMEOUT  : 답변 없이 만료 (terminal)</li>
 * </ul>
 */
public enum RequestStatus {
    PENDING,
    RESOLVED,
    TIMEOUT
}
