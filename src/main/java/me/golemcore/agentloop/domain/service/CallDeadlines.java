package me.golemcore.agentloop.domain.service;

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

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Waits on external calls (LLM, tools) under a deadline and maps the ways the
 * wait can end onto distinct exceptions:
 * <ul>
 * <li>deadline elapsed: {@link DeadlineExceededException}</li>
 * <li>caller interrupted or future cancelled: {@link AgentCancelledException}
 * (the interrupt flag is restored)</li>
 * <li>call failed: the cause, unwrapped when it is unchecked</li>
 * </ul>
 */
public final class CallDeadlines {

    private CallDeadlines() {
    }

    public static <T> T await(Future<T> future, Duration deadline) {
        if (future == null) {
            throw new IllegalStateException("Call returned no future");
        }
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DeadlineExceededException(deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AgentCancelledException("Interrupted while waiting for call", e);
        } catch (CancellationException e) {
            throw new AgentCancelledException("Call was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CancellationException) {
                throw new AgentCancelledException("Call was cancelled", cause);
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new CompletionException(cause);
        }
    }

    /**
     * Message of the innermost cause, or its class name when it has none.
     */
    public static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
