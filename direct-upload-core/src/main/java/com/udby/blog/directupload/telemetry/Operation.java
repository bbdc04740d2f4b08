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
package com.udby.blog.directupload.telemetry;

public enum Operation {
    MULTIPART_CREATE,
    MULTIPART_COMPLETE,
    MULTIPART_ABORT,
    PUBLIC_URL,
    UPLOAD_BUFFER,
    SIGNED_URL,
    UPLOAD_PREFIX
}
