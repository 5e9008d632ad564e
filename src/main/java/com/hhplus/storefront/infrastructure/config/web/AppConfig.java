package com.hhplus.storefront.infrastructure.config.web;

import org.springframework.boot.web.servlet.ServletListenerRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import org.springframework.web.util.HttpSessionMutexListener;

/**
 * AppConfig - API 전역 설정
 *
 * - 모든 @RestController 매핑에 /api prefix를 추가한다. (예: /cart → /api/cart)
 * - 세션마다 전용 뮤텍스 객체를 두어 장바구니 갱신을 세션 단위로 직렬화한다.
 */
@Configuration
public class AppConfig implements WebMvcConfigurer {

    private static final String API_PREFIX = "/api";

    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
        // BasicErrorController(@Controller)는 /error 경로를 유지해야 하므로 제외
        configurer.addPathPrefix(API_PREFIX, c -> c.isAnnotationPresent(RestController.class));
    }

    @Bean
    public ServletListenerRegistrationBean<HttpSessionMutexListener> httpSessionMutexListener() {
        return new ServletListenerRegistrationBean<>(new HttpSessionMutexListener());
    }
}
