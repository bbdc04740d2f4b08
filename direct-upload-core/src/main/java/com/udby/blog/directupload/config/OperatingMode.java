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
package com.udby.blog.directupload.config;

import java.util.Locale;

/**
 * Operating mode of the hosting application. Anything but production allows any origin for uploads.
 */
public enum OperatingMode {
    DEVELOPMENT,
    TEST,
    PRODUCTION;

    public boolean isProduction() {
        return this == PRODUCTION;
    }

    /**
     * @param value mode name, case-insensitive; null or blank means development, unknown values are treated as
     *              development as well
     */
    public static OperatingMode parse(String value) {
        if (value == null || value.isBlank()) {
            return DEVELOPMENT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "production", "prod" -> PRODUCTION;
            case "test" -> TEST;
            default -> DEVELOPMENT;
        };
    }
}
