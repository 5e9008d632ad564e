package com.hhplus.storefront.domain.user;

/**
 * 비밀번호 해시 Port
 * 구현체: infrastructure.security.BCryptPasswordHasher
 */
public interface PasswordHasher {

    /** BCrypt 입력 한도. 이보다 긴 비밀번호는 뒷부분이 무시된다. */
    int MAX_PASSWORD_BYTES = 72;

    String hash(String rawPassword);

    /**
     * 평문 비밀번호가 저장된 해시와 일치하는지 확인
     * 해시 형식이 올바르지 않으면 false를 반환한다.
     */
    boolean matches(String rawPassword, String passwordHash);
}
