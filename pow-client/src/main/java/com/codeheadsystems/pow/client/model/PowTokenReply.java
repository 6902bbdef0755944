package com.codeheadsystems.pow.client.model;

import com.codeheadsystems.pow.model.PowTokenResponse;

/**
 * A decoded HTTP 200 reply from the issuing service.
 *
 * @param statusCode the HTTP status code.
 * @param body       the raw response body, kept for error diagnostics.
 * @param envelope   the decoded envelope.
 */
public record PowTokenReply(int statusCode, String body, PowTokenResponse envelope) {

}
