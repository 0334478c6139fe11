package com.demo.groupchat.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * User record, stored in the {@code users} collection.
 *
 * Also embedded by value in every {@link Message} as the sender snapshot.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class User implements Serializable {
    private static final long serialVersionUID = 1L;

    private String userId;
    private String displayName;
    private String phoneNumber;   // E.164
    private String email;
    private String fcmToken;
}
