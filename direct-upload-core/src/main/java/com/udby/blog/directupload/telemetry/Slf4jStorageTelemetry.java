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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Slf4jStorageTelemetry implements StorageTelemetry {
    private static final Logger log = LoggerFactory.getLogger(Slf4jStorageTelemetry.class);

    @Override
    public void record(StorageEvent event) {
        if (event.success()) {
            log.debug("{} succeeded in {} ms {}", event.operation(), event.elapsed().toMillis(), event.attributes());
        } else {
            log.warn("{} failed after {} ms {}: {}", event.operation(), event.elapsed().toMillis(), event.attributes(),
                    String.valueOf(event.failure()));
        }
    }
}
