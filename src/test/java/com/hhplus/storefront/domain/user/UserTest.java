package com.hhplus.storefront.domain.user;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("User 도메인 엔티티 테스트")
class UserTest {

    @Test
    @DisplayName("가입 시 아이디는 trim, 이메일은 trim 후 소문자로 저장")
    void testRegister_Normalizes() {
        // When
        User user = User.register("  alice ", " Alice@Example.COM ", "$2a$04$hash");

        // Then
        assertEquals("alice", user.getUsername());
        assertEquals("alice@example.com", user.getEmail());
        assertNotNull(user.getCreatedAt());
    }

    @Test
    @DisplayName("필수값 누락 시 예외")
    void testRegister_Blank() {
        assertThrows(IllegalArgumentException.class, () -> User.register(" ", "a@b.c", "hash"));
        assertThrows(IllegalArgumentException.class, () -> User.register("alice", null, "hash"));
        assertThrows(IllegalArgumentException.class, () -> User.register("alice", "a@b.c", ""));
    }
}
