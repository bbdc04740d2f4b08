/*
Copyright 2025 Jesper Udby

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package com.udby.blog.directupload;

import com.udby.blog.directupload.s3.S3ResponseException;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Failure of a {@link DirectUploadService} operation. The cause is kept as is.
 */
public class StorageServiceException extends Exception {
    private final ErrorCode errorCode;

    public StorageServiceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * @return HTTP status of the store response, when the store answered with an error
     */
    public OptionalInt statusCode() {
        if (getCause() instanceof S3ResponseException responseException) {
            return OptionalInt.of(responseException.getResponseStatusCode());
        }
        return OptionalInt.empty();
    }

    @Override
    public String toString() {
        return "StorageServiceException{" +
                "errorCode=" + errorCode +
                ", message=" + getMessage() +
                '}';
    }
}
