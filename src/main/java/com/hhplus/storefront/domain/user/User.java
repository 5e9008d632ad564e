package com.hhplus.storefront.domain.user;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * User 도메인 엔티티
 *
 * 핵심 비즈니스 규칙:
 * - 아이디(username)는 유일
 * - 이메일은 소문자로 저장하며 대소문자 무시 기준으로 유일
 * - 비밀번호는 해시만 보관
 */
@Entity
@Table(name = "users", uniqueConstraints = {
    @UniqueConstraint(name = "uk_users_username", columnNames = "username"),
    @UniqueConstraint(name = "uk_users_email", columnNames = "email")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "username", nullable = false, length = 150)
    private String username;

    @Column(name = "email", nullable = false, length = 254)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 사용자 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 아이디는 앞뒤 공백 제거
     * - 이메일은 앞뒤 공백 제거 후 소문자로 정규화
     */
    public static User register(String username, String email, String passwordHash) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("아이디는 필수입니다");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("이메일은 필수입니다");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("비밀번호 해시는 필수입니다");
        }

        return User.builder()
                .username(username.trim())
                .email(normalizeEmail(email))
                .passwordHash(passwordHash)
                .createdAt(LocalDateTime.now())
                .build();
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
