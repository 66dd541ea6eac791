package com.capgate.gatekeeper.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of every 4xx response.
 *
 * @param error   Machine-readable kind, e.g. "path_escape" or "not_pending".
 * @param message Human-readable detail.
 * @param path    Workspace path involved, for patch failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, String path) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null);
    }
}
