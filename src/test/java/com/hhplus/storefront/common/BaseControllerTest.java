package com.hhplus.storefront.common;

import org.springframework.test.context.TestPropertySource;

/**
 * BaseControllerTest - Controller 계층 테스트 기본 클래스
 *
 * - spring.web.resources.add-mappings=false로 정적 리소스 매핑 비활성화
 * - 단위 테스트는 MockMvcBuilders.standaloneSetup(controller)로 MockMvc를 직접 구성한다
 * - 세션 장바구니/로그인 상태는 MockHttpSession으로 주입한다
 */
@TestPropertySource(properties = {
    "spring.web.resources.add-mappings=false"
})
public abstract class BaseControllerTest {
}
