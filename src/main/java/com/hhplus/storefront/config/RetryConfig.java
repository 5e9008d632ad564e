package com.hhplus.storefront.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * RetryConfig - Spring Retry 설정 클래스
 *
 * 역할:
 * - @Retryable, @Recover 어노테이션 활성화
 *
 * 적용 대상:
 * - OrderTransactionService: 결제 중 상품 행 잠금 획득 실패 시 제한된 횟수만 재시도
 *   (backoff random=true로 동시 재시도 분산)
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
