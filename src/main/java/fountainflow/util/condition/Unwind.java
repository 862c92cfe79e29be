// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.util.condition;

/**
 * Throwable used by the restart mechanism to transfer control to a given restart point.
 * <p>
 * Exposed only so that methods can be declared as throwing it. It extends {@link Throwable} directly, so that
 * {@code catch (Exception e)} blocks in between don't intercept it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final Restart target) {
        super("Unwinding to restart point " + target.name(), null, false, false);
        this.target = target;
    }

    Restart target() {
        return target;
    }

    // Unwinds are never serialized, they merely inherit serializability from Throwable.
    private final transient Restart target;
}
