/*
 * Copyright 2025 Netflix, Inc.
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
 */

package com.netflix.spiffe.enable.webhook;

import java.util.Collection;

import com.netflix.spiffe.enable.common.util.StringExt;

import static java.lang.String.format;

public class SpiffeEnableException extends RuntimeException {

    public enum ErrorCode {
        MalformedRequest(400),
        InvalidMode(403),
        RenderFailure(500),
        MarshalFailure(500),
        Internal(500);

        private final int httpStatus;

        ErrorCode(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int getHttpStatus() {
            return httpStatus;
        }
    }

    private final ErrorCode errorCode;

    private SpiffeEnableException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    private SpiffeEnableException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Returns true, if the argument holds a {@link SpiffeEnableException} caused by the caller (bad request payload or
     * annotation values), and false for errors that indicate a defect in the webhook itself.
     */
    public static boolean isExpected(Throwable error) {
        if (!(error instanceof SpiffeEnableException)) {
            return false;
        }
        switch (((SpiffeEnableException) error).getErrorCode()) {
            case MalformedRequest:
            case InvalidMode:
                return true;
            case RenderFailure:
            case MarshalFailure:
            case Internal:
                return false;
        }
        return false;
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof SpiffeEnableException) && ((SpiffeEnableException) error).getErrorCode() == errorCode;
    }

    public static SpiffeEnableException malformedRequest(String reason) {
        return new SpiffeEnableException(ErrorCode.MalformedRequest, reason);
    }

    public static SpiffeEnableException malformedRequest(String reason, Throwable cause) {
        return new SpiffeEnableException(ErrorCode.MalformedRequest, format("%s: %s", reason, cause.getMessage()), cause);
    }

    public static SpiffeEnableException invalidMode(String annotation,
                                                    String value,
                                                    Collection<String> invalidTokens,
                                                    Collection<String> allowedTokens) {
        return new SpiffeEnableException(
                ErrorCode.InvalidMode,
                format("invalid value \"%s\" for annotation \"%s\": unrecognized modes [%s]; allowed values are [%s]",
                        value, annotation, StringExt.concatenate(invalidTokens, ", "), StringExt.concatenate(allowedTokens, ", "))
        );
    }

    public static SpiffeEnableException renderFailure(String what, String reason) {
        return new SpiffeEnableException(ErrorCode.RenderFailure, format("failed to render %s: %s", what, reason));
    }

    public static SpiffeEnableException renderFailure(String what, Throwable cause) {
        return new SpiffeEnableException(ErrorCode.RenderFailure, format("failed to render %s: %s", what, cause.getMessage()), cause);
    }

    public static SpiffeEnableException marshalFailure(Throwable cause) {
        return new SpiffeEnableException(ErrorCode.MarshalFailure, format("failed to marshal the mutated pod: %s", cause.getMessage()), cause);
    }

    public static SpiffeEnableException internal(Throwable cause) {
        return new SpiffeEnableException(ErrorCode.Internal, format("unexpected error: %s", cause.getMessage()), cause);
    }
}
