package com.procureagent.common.web;

import java.time.Instant;

/**
 * JSON error body returned by every service.
 *
 * @param error   exception type, e.g. {@code DuplicateSessionException}
 * @param message component-prefixed detail
 */
public record ErrorResponse(String error, String message, String path, Instant timestamp) {}
