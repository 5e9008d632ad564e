package com.hhplus.storefront.presentation.common.session;

import com.hhplus.storefront.domain.user.LoginRequiredException;
import com.hhplus.storefront.domain.user.User;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 로그인 상태 관리 (세션 속성 "login_user_id")
 */
@Component
public class LoginSession {

    public static final String USER_ID_ATTRIBUTE = "login_user_id";

    /**
     * 로그인 처리
     * 세션 ID를 새로 발급하되 기존 세션 속성(장바구니 등)은 유지한다.
     */
    public void login(HttpServletRequest request, User user) {
        HttpSession session = request.getSession(true);
        request.changeSessionId();
        session.setAttribute(USER_ID_ATTRIBUTE, user.getUserId());
    }

    public Optional<Long> currentUserId(HttpSession session) {
        if (session == null) {
            return Optional.empty();
        }
        Object value = session.getAttribute(USER_ID_ATTRIBUTE);
        return value instanceof Long userId ? Optional.of(userId) : Optional.empty();
    }

    /**
     * @throws LoginRequiredException 로그인하지 않은 세션
     */
    public Long requireUserId(HttpSession session) {
        return currentUserId(session).orElseThrow(LoginRequiredException::new);
    }

    /**
     * 로그아웃: 세션 전체(장바구니 포함)를 폐기한다.
     */
    public void logout(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.invalidate();
        }
    }
}
