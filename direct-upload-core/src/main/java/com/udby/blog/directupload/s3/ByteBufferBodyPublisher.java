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
package com.udby.blog.directupload.s3;

import java.net.http.HttpRequest;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Helper class for PUT-ing a ByteBuffer via HttpClient without copying it into a byte array.
 * <p>
 * Every subscription gets its own read-only view of the buffer, so the client may subscribe again (e.g. when following
 * a redirect) and still send the full content.
 * <p>
 * Inspired by OneShotPublisher from <a href="https://docs.oracle.com/en/java/javase/17/docs/api/java.base/java/util/concurrent/Flow.html">Flow</a>
 */
public class ByteBufferBodyPublisher implements HttpRequest.BodyPublisher {
    private final ByteBuffer byteBuffer;

    public ByteBufferBodyPublisher(ByteBuffer byteBuffer) {
        this.byteBuffer = Objects.requireNonNull(byteBuffer, "byteBuffer").asReadOnlyBuffer();
    }

    @Override
    public long contentLength() {
        return byteBuffer.remaining();
    }

    @Override
    public void subscribe(Flow.Subscriber<? super ByteBuffer> subscriber) {
        subscriber.onSubscribe(new ByteBufferSubscription(subscriber, byteBuffer.duplicate()));
    }

    static final class ByteBufferSubscription implements Flow.Subscription {
        private final Flow.Subscriber<? super ByteBuffer> subscriber;
        private final ByteBuffer view;
        private final AtomicBoolean completed = new AtomicBoolean();

        ByteBufferSubscription(Flow.Subscriber<? super ByteBuffer> subscriber, ByteBuffer view) {
            this.subscriber = subscriber;
            this.view = view;
        }

        @Override
        public void request(long n) {
            if (completed.compareAndSet(false, true)) {
                if (n <= 0) {
                    subscriber.onError(new IllegalArgumentException("non-positive request: %d".formatted(n)));
                } else {
                    if (view.hasRemaining()) {
                        subscriber.onNext(view);
                    }
                    subscriber.onComplete();
                }
            }
        }

        @Override
        public void cancel() {
            completed.set(true);
        }
    }
}
