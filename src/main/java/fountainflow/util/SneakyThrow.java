// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.util;

/**
 * Facilities for bypassing the checked exception mechanism.
 * <p>
 * Used for {@link fountainflow.util.condition.Unwind}, which has to travel through parsing and generation code that
 * knows nothing about restarts, and for the {@link InterruptedException} of a console lock wait.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as an <em>unchecked exception</em>, no matter its static nor dynamic type.
     * <p>
     * Since this method never returns normally, it's declared to return {@link UnreachableCodeReachedError} that can
     * be "thrown" at call sites to help the compiler's control flow analysis.
     */
    public static UnreachableCodeReachedError doThrow(final Throwable throwable) {
        throw doThrowImpl(throwable);
    }

    // E is inferred as RuntimeException at the call site, and erased to Throwable, so the cast is a no-op.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> UnreachableCodeReachedError doThrowImpl(final Throwable throwable) throws E {
        throw (E) throwable;
    }
}
