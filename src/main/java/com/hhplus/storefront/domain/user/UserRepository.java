package com.hhplus.storefront.domain.user;

import java.util.Optional;

/**
 * User Repository Interface (Domain Layer - Port)
 *
 * 로그인 후보 조회 순서:
 * 1. 아이디 일치
 * 2. 이메일 일치 (대소문자 무시)
 */
public interface UserRepository {

    Optional<User> findById(Long userId);

    Optional<User> findByUsername(String username);

    /**
     * 이메일로 조회 (대소문자 무시)
     */
    Optional<User> findByEmailIgnoreCase(String email);

    boolean existsByUsername(String username);

    boolean existsByEmailIgnoreCase(String email);

    User save(User user);
}
