package com.hhplus.storefront.presentation.auth;

import com.hhplus.storefront.application.auth.AuthService;
import com.hhplus.storefront.application.auth.dto.RegisterCommand;
import com.hhplus.storefront.domain.user.User;
import com.hhplus.storefront.presentation.auth.request.LoginRequest;
import com.hhplus.storefront.presentation.auth.request.RegisterRequest;
import com.hhplus.storefront.presentation.auth.response.UserResponse;
import com.hhplus.storefront.presentation.common.session.LoginSession;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AuthController - Presentation 계층
 * 회원가입/로그인/로그아웃 API
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;
    private final LoginSession loginSession;

    public AuthController(AuthService authService, LoginSession loginSession) {
        this.authService = authService;
        this.loginSession = loginSession;
    }

    /**
     * POST /auth/login - 로그인
     */
    @PostMapping("/login")
    public ResponseEntity<UserResponse> login(@Valid @RequestBody LoginRequest request,
                                              HttpServletRequest httpRequest) {
        User user = authService.login(request.getUsername(), request.getPassword());
        loginSession.login(httpRequest, user);
        return ResponseEntity.ok(UserResponse.from(user));
    }

    /**
     * POST /auth/register - 회원가입 후 바로 로그인
     */
    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request,
                                                 HttpServletRequest httpRequest) {
        User user = authService.register(RegisterCommand.builder()
                .username(request.getUsername())
                .email(request.getEmail())
                .password(request.getPassword())
                .confirmPassword(request.getConfirmPassword())
                .build());
        loginSession.login(httpRequest, user);
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    /**
     * POST /auth/logout - 로그아웃 (세션 폐기)
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(HttpServletRequest httpRequest) {
        loginSession.logout(httpRequest);
        return ResponseEntity.noContent().build();
    }
}
