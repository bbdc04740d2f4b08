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

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one storage operation.
 *
 * @param operation  what was attempted
 * @param success    whether it succeeded
 * @param elapsed    wall time spent
 * @param attributes operation specific details such as key and upload id, never credentials
 * @param failure    the failure, null on success
 */
public record StorageEvent(Operation operation,
                           boolean success,
                           Duration elapsed,
                           Map<String, Object> attributes,
                           Throwable failure) {
    public StorageEvent {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(elapsed, "elapsed");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static StorageEvent succeeded(Operation operation, Duration elapsed, Map<String, Object> attributes) {
        return new StorageEvent(operation, true, elapsed, attributes, null);
    }

    public static StorageEvent failed(Operation operation, Duration elapsed, Map<String, Object> attributes, Throwable failure) {
        return new StorageEvent(operation, false, elapsed, attributes, Objects.requireNonNull(failure, "failure"));
    }
}
