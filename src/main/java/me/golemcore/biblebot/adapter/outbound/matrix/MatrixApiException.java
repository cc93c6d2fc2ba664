package me.golemcore.biblebot.adapter.outbound.matrix;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Non-2xx response from the Matrix client-server API.
 */
public class MatrixApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final int status;
    private final String errcode;
    private final Long retryAfterMs;

    public MatrixApiException(int status, String errcode, String message, Long retryAfterMs) {
        super("Matrix API error " + status + (errcode != null ? " " + errcode : "")
                + (message != null ? ": " + message : ""));
        this.status = status;
        this.errcode = errcode;
        this.retryAfterMs = retryAfterMs;
    }

    public int getStatus() {
        return status;
    }

    public String getErrcode() {
        return errcode;
    }

    /**
     * Server-provided back-off for rate limited requests, or {@code null}.
     */
    public Long getRetryAfterMs() {
        return retryAfterMs;
    }

    public boolean isRateLimited() {
        return status == HTTP_TOO_MANY_REQUESTS || "M_LIMIT_EXCEEDED".equals(errcode);
    }

    public boolean isUnauthorized() {
        return status == HTTP_UNAUTHORIZED || "M_UNKNOWN_TOKEN".equals(errcode);
    }
}
