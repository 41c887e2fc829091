/*
 * Copyright 2024 asyncer.io projects
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.asyncer.mysql.wire.internal.util;

import org.jetbrains.annotations.Nullable;

/**
 * Argument checks for the codec, all of them fail with {@link IllegalArgumentException} so that a rejected
 * call never touches the cursor.
 */
public final class AssertUtils {

    /**
     * Checks that an object is not {@code null}.
     *
     * @param obj     the object reference to check for nullity.
     * @param message the detail message to be used by thrown {@link IllegalArgumentException}.
     * @param <T>     the type of the reference.
     * @return {@code obj} if not {@code null}.
     * @throws IllegalArgumentException if {@code obj} is {@code null}.
     */
    public static <T> T requireNonNull(@Nullable T obj, String message) {
        if (obj == null) {
            throw new IllegalArgumentException(message);
        }

        return obj;
    }

    /**
     * Checks that a condition is accepted.
     *
     * @param condition if condition accepted.
     * @param message   the detail message to be used by thrown {@link IllegalArgumentException}.
     * @throws IllegalArgumentException if {@code condition} is {@code false}.
     */
    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Checks that a length or count is not negative and fits a Java array.
     *
     * @param length the length to check.
     * @param name   the name of the checked value, used in the detail message.
     * @return {@code length} as an {@code int}.
     * @throws IllegalArgumentException if {@code length} is negative or greater than
     *                                  {@link Integer#MAX_VALUE}.
     */
    public static int requireArrayLength(long length, String name) {
        if (length < 0 || length > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + " must be between 0 and " + Integer.MAX_VALUE +
                ", but was " + length);
        }

        return (int) length;
    }

    private AssertUtils() { }
}
