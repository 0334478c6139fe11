package com.demo.groupchat.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Verified identity of the caller, taken from the bearer token claims.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallerIdentity {

    private String userId;
    private String email;
    private String phoneNumber;
    private String displayName;
}
