package com.hhplus.storefront.application.auth;

import com.hhplus.storefront.application.auth.dto.RegisterCommand;
import com.hhplus.storefront.common.exception.ValidationException;
import com.hhplus.storefront.domain.user.AuthenticationFailedException;
import com.hhplus.storefront.domain.user.PasswordHasher;
import com.hhplus.storefront.domain.user.User;
import com.hhplus.storefront.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * AuthService - 회원가입/로그인 (Application 계층)
 *
 * 로그인 상태(세션)는 Presentation 계층의 LoginSession이 관리한다.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;

    public AuthService(UserRepository userRepository, PasswordHasher passwordHasher) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
    }

    /**
     * 회원가입
     *
     * 검증 항목:
     * 1. 아이디, 이메일, 비밀번호 필수
     * 2. 비밀번호 길이 (UTF-8 기준 72바이트 이하), 비밀번호 확인 일치
     * 3. 아이디 중복
     * 4. 이메일 중복 (대소문자 무시)
     *
     * @throws ValidationException 검증 실패 항목 목록 포함
     */
    @Transactional(rollbackFor = Exception.class)
    public User register(RegisterCommand command) {
        String username = command.getUsername() == null ? "" : command.getUsername().trim();
        String email = command.getEmail() == null ? "" : User.normalizeEmail(command.getEmail());
        String password = command.getPassword();

        List<String> errors = new ArrayList<>();
        if (username.isEmpty()) {
            errors.add("username: 필수 입력값입니다");
        }
        if (email.isEmpty()) {
            errors.add("email: 필수 입력값입니다");
        }
        if (password == null || password.isEmpty()) {
            errors.add("password: 필수 입력값입니다");
        } else if (password.getBytes(StandardCharsets.UTF_8).length > PasswordHasher.MAX_PASSWORD_BYTES) {
            errors.add("password: 비밀번호는 " + PasswordHasher.MAX_PASSWORD_BYTES + "바이트 이하여야 합니다");
        } else if (!password.equals(command.getConfirmPassword())) {
            errors.add("confirm_password: 비밀번호가 일치하지 않습니다");
        }
        if (!username.isEmpty() && userRepository.existsByUsername(username)) {
            errors.add("username: 이미 사용 중인 아이디입니다");
        }
        if (!email.isEmpty() && userRepository.existsByEmailIgnoreCase(email)) {
            errors.add("email: 이미 가입된 이메일입니다");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        try {
            User saved = userRepository.save(User.register(username, email, passwordHasher.hash(password)));
            log.info("[AuthService] 회원가입 완료 - userId={}, username={}", saved.getUserId(), saved.getUsername());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("[AuthService] 동시 가입으로 인한 중복 - username={}, email={}", username, email);
            throw new ValidationException("username/email: 이미 사용 중인 아이디 또는 이메일입니다");
        }
    }

    /**
     * 로그인
     *
     * 후보 조회 순서: 아이디 일치 → 이메일 일치(대소문자 무시).
     * 비밀번호가 일치하는 첫 번째 후보로 로그인한다.
     *
     * @param usernameOrEmail 아이디 또는 이메일
     * @throws AuthenticationFailedException 일치하는 사용자 없음 (사유 구분 없음)
     */
    @Transactional(readOnly = true)
    public User login(String usernameOrEmail, String password) {
        if (usernameOrEmail == null || usernameOrEmail.isBlank() || password == null || password.isEmpty()) {
            throw new AuthenticationFailedException();
        }
        String identifier = usernameOrEmail.trim();

        Optional<User> authenticated = Stream.of(
                        userRepository.findByUsername(identifier),
                        userRepository.findByEmailIgnoreCase(identifier))
                .flatMap(Optional::stream)
                .filter(user -> passwordHasher.matches(password, user.getPasswordHash()))
                .findFirst();

        return authenticated
                .map(user -> {
                    log.info("[AuthService] 로그인 성공 - userId={}", user.getUserId());
                    return user;
                })
                .orElseThrow(() -> {
                    log.warn("[AuthService] 로그인 실패 - identifier={}", identifier);
                    return new AuthenticationFailedException();
                });
    }
}
