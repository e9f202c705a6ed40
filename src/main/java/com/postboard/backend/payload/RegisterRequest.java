package com.postboard.backend.payload;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Registration form fields. The controller binds {@code confirmPassword} from the
 * {@code confirm_password} form parameter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"password", "confirmPassword"})
public class RegisterRequest {
    private String username;
    private String email;
    private String password;
    private String confirmPassword;
}
