// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package fountainflow.test;

import java.util.ArrayList;
import fountainflow.util.Trace;
import fountainflow.util.condition.Condition;
import fountainflow.util.condition.ConditionContext;
import fountainflow.util.condition.Handler;
import fountainflow.util.condition.UnhandledErrorError;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void signalWithoutHandlersReturnsNormally() {
        ConditionContext.signal(new TestCondition("nobody listens"));
    }

    @Test
    void handlersRunFromNewestToOldest() {
        final var order = new ArrayList<String>();
        try (
            final var outer = new Handler(c -> order.add("outer"));
            final var inner = new Handler(c -> order.add("inner"))
        ) {
            outer.use();
            inner.use();
            ConditionContext.signal(new TestCondition("x"));
        }
        Assertions.assertThat(order).containsExactly("inner", "outer");
    }

    @Test
    void handlerCanUnwindToRestart() {
        final var result = ConditionContext.withRestart("give-up", restart -> {
            try (final var handler = new Handler(c -> restart.unwindTo())) {
                handler.use();
                throw ConditionContext.error(new TestCondition("fatal"));
            }
        });
        Assertions.assertThat(result).isNull();
    }

    @Test
    void restartReturnsCallbackValueWhenNothingUnwinds() {
        final var result = ConditionContext.withRestart("unused", restart -> 42);
        Assertions.assertThat(result).isEqualTo(42);
    }

    @Test
    void restartsAreListedNewestFirst() {
        final var names = new ArrayList<String>();
        ConditionContext.withRestart("outer", outer -> ConditionContext.withRestart("inner", inner -> {
            for (final var restart : ConditionContext.restarts()) {
                names.add(restart.name());
            }
            return null;
        }));
        Assertions.assertThat(names).containsExactly("inner", "outer");
    }

    @Test
    void errorWithoutUnwindingHandlerThrows() {
        try (final var diagnostics = new Diagnostics()) {
            Assertions.assertThatThrownBy(() -> {
                throw ConditionContext.error(new TestCondition("fatal"));
            }).isInstanceOf(UnhandledErrorError.class);
            Assertions.assertThat(diagnostics.all()).extracting(Condition::message).containsExactly("fatal");
        }
    }

    @Test
    void handlersSeeActiveTracesInnermostFirst() {
        final var traces = new ArrayList<String>();
        try (final var handler = new Handler(c -> Trace.activeTraces().forEach(traces::add))) {
            handler.use();
            try (final var outer = new Trace("Converting a script")) {
                outer.use();
                try (final var inner = new Trace(() -> "Parsing line " + 3)) {
                    inner.use();
                    ConditionContext.signal(new TestCondition("x"));
                }
            }
        }
        Assertions.assertThat(traces).containsExactly("Parsing line 3", "Converting a script");
        Assertions.assertThat(Trace.activeTraces()).isEmpty();
    }

    private static final class TestCondition extends Condition {
        TestCondition(final String message) {
            super(message);
        }
    }
}
