package com.sdclogin.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sdclogin.auth.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ProfileResponse - the public projection of a user.
 *
 * Example Response:
 * <pre>
 * {
 *   "user_id": "101",
 *   "name": "Nick Gravgaard",
 *   "email": "nick.gravgaard@example.com"
 * }
 * </pre>
 *
 * Never carries the password hash or the internal surrogate id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {

    @JsonProperty("user_id")
    private String userId;

    private String name;

    private String email;

    public static ProfileResponse from(User user) {
        return ProfileResponse.builder()
                .userId(user.getUserId())
                .name(user.getName())
                .email(user.getEmail())
                .build();
    }
}
