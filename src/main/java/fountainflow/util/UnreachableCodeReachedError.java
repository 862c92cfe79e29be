// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.util;

/**
 * The nominal return type of {@link SneakyThrow#doThrow(Throwable)}, letting callers write {@code throw doThrow(e)}.
 * Being a programming error if it ever gets constructed, it extends {@link AssertionError}.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError() {
        super("Execution reached a point expected to be unreachable");
    }
}
