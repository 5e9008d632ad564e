package com.hhplus.storefront.presentation.auth.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 회원가입 요청 DTO
 *
 * 필수값, 비밀번호 확인, 중복 검사는 AuthService에서 수행한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @Size(max = 150, message = "아이디는 150자 이하여야 합니다")
    private String username;

    @Email(message = "올바른 이메일 형식이 아닙니다")
    private String email;

    private String password;

    @JsonProperty("confirm_password")
    private String confirmPassword;
}
