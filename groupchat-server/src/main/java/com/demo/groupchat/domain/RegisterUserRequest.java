package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registration input. The caller's userId always comes from the verified identity;
 * the other fields fall back to token claims when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterUserRequest {

    private String userId;
    private String email;
    private String phoneNumber;
    private String displayName;
    private String fcmToken;
}
