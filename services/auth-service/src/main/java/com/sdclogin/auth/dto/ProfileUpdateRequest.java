package com.sdclogin.auth.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ProfileUpdateRequest - the fields a caller may change on their own profile.
 *
 * Only name is mutable. Other JSON fields in the body are ignored rather than rejected,
 * and a missing or null name leaves the profile unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfileUpdateRequest {

    @Size(max = 255)
    private String name;
}
