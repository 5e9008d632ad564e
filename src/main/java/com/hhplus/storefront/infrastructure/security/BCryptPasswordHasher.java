package com.hhplus.storefront.infrastructure.security;

import com.hhplus.storefront.domain.user.PasswordHasher;
import org.mindrot.jbcrypt.BCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * BCrypt 기반 PasswordHasher 구현 (jBCrypt)
 */
@Component
public class BCryptPasswordHasher implements PasswordHasher {

    private static final Logger log = LoggerFactory.getLogger(BCryptPasswordHasher.class);

    private final int logRounds;

    public BCryptPasswordHasher(@Value("${storefront.security.bcrypt-log-rounds:10}") int logRounds) {
        this.logRounds = logRounds;
    }

    @Override
    public String hash(String rawPassword) {
        if (exceedsLimit(rawPassword)) {
            throw new IllegalArgumentException("비밀번호는 " + MAX_PASSWORD_BYTES + "바이트 이하여야 합니다");
        }
        return BCrypt.hashpw(rawPassword, BCrypt.gensalt(logRounds));
    }

    @Override
    public boolean matches(String rawPassword, String passwordHash) {
        if (rawPassword == null || passwordHash == null || exceedsLimit(rawPassword)) {
            return false;
        }
        try {
            return BCrypt.checkpw(rawPassword, passwordHash);
        } catch (IllegalArgumentException e) {
            log.warn("[BCryptPasswordHasher] 저장된 해시 형식이 올바르지 않습니다: {}", e.getMessage());
            return false;
        }
    }

    private static boolean exceedsLimit(String rawPassword) {
        return rawPassword != null && rawPassword.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
