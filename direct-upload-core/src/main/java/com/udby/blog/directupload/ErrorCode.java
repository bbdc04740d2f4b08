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

/**
 * What went wrong, from the application's point of view.
 */
public enum ErrorCode {
    MULTIPART_INIT_FAILED,
    MULTIPART_COMPLETE_FAILED,
    MULTIPART_ABORT_FAILED,
    UPLOAD_FAILED,
    PUBLIC_URL_UNAVAILABLE,
    SIGNED_URL_FAILED
}
