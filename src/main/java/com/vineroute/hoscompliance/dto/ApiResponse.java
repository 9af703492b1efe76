package com.vineroute.hoscompliance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * Response envelope shared by every endpoint.
 *
 *   ApiResponse.success(data, message)
 *   ApiResponse.error(errorCode, message)
 *
 * errorCode is the typed error name (e.g. "VehicleInUse") and is omitted on success.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {

    private boolean success;
    private String message;
    private String errorCode;
    private Object data;

    public static ApiResponse success(Object data, String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(true);
        r.setMessage(message);
        r.setData(data);
        return r;
    }

    public static ApiResponse success(String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(true);
        r.setMessage(message);
        return r;
    }

    public static ApiResponse error(String errorCode, String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(false);
        r.setErrorCode(errorCode);
        r.setMessage(message);
        return r;
    }

}
