package com.sdclogin.auth.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error envelope for every non-2xx response: {"message": "&lt;cause&gt;: &lt;request url&gt;"}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    private String message;
}
