// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.util;

import org.jetbrains.annotations.NotNull;

/**
 * Facilities for bypassing the checked exception mechanism.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as an unchecked exception, regardless of its type.
     * <p>
     * Reserved for throwables that pass through code which cannot reasonably declare them: {@link InterruptedException}
     * raised while a worker waits on a queue, and {@link tessera.util.condition.Unwind} crossing a lambda.
     * <p>
     * Never returns normally; the declared return type lets call sites write {@code throw SneakyThrow.doThrow(e)}.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    /**
     * Pretends to throw {@code E}, so that a sneakily thrown checked exception of that type can be caught.
     */
    @SuppressWarnings({"RedundantThrows", "EmptyMethod"})
    public static <E extends Throwable> void pretendThrows() throws E {
    }

    // E is erased to Throwable, so the cast vanishes in bytecode, while javac infers E as RuntimeException.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
