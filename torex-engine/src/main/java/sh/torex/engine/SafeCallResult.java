// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.torex.engine;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a contained controller call: either the hook's value or the captured failure.
 *
 * @param <T>           the hook's return type
 * @param value         the returned value, null on failure
 * @param failureReason the captured failure, null on success
 */
public record SafeCallResult<T>(@Nullable T value, @Nullable String failureReason) {

    public static <T> SafeCallResult<T> success(final @Nullable T value) {
        return new SafeCallResult<>(value, null);
    }

    public static <T> SafeCallResult<T> failure(final String reason) {
        return new SafeCallResult<>(null, reason);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    /**
     * Returns the value, or {@code fallback} if the call failed or returned null.
     */
    public T orElse(final T fallback) {
        return value != null ? value : fallback;
    }
}
