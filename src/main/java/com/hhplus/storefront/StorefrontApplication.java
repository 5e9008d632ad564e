package com.hhplus.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Storefront 애플리케이션 메인 클래스
 *
 * 재시도(@EnableRetry)는 config.RetryConfig에서 활성화한다.
 */
@SpringBootApplication
public class StorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }

}
