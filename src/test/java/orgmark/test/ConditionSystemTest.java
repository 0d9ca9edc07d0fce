// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package orgmark.test;

import java.util.ArrayList;
import java.util.List;
import orgmark.util.Trace;
import orgmark.util.condition.Condition;
import orgmark.util.condition.ConditionContext;
import orgmark.util.condition.Handler;
import orgmark.util.condition.Restart;
import orgmark.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.junit.jupiter.api.Test;

final class ConditionSystemTest {
    @Test
    void signalWithoutHandlersReturns() {
        ConditionContext.signal(new TestCondition("ignored"));
    }

    @Test
    void handlersRunNewestFirst() {
        final var order = new ArrayList<String>();
        try (final var outer = new Handler(c -> order.add("outer"))) {
            outer.use();
            try (final var inner = new Handler(c -> order.add("inner"))) {
                inner.use();
                ConditionContext.signal(new TestCondition("x"));
            }
        }
        assertThat(order).containsExactly("inner", "outer");
    }

    @Test
    void unhandledErrorThrows() {
        final var condition = new TestCondition("boom");
        final var error = catchThrowableOfType(() -> {
            throw ConditionContext.error(condition);
        }, UnhandledErrorError.class);
        assertThat(error).isNotNull();
        assertThat(error.condition()).isSameAs(condition);
    }

    @Test
    void handlerCanUnwindToRestart() {
        final var result = ConditionContext.withRestart("give-up", restart -> {
            try (final var handler = new Handler(c -> restart.unwindTo())) {
                handler.use();
                throw ConditionContext.error(new TestCondition("boom"));
            }
        });
        assertThat(result).isNull();
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void restartReturnsCallbackResultWhenNotUnwound() {
        final String result = ConditionContext.withRestart("unused", restart -> "value");
        assertThat(result).isEqualTo("value");
    }

    @Test
    void restartsAreListedNewestFirst() {
        final List<String> names = ConditionContext.withRestart("outer", outer ->
            ConditionContext.withRestart("inner", inner -> {
                final var result = new ArrayList<String>();
                for (final Restart restart : ConditionContext.restarts()) {
                    result.add(restart.name());
                }
                assertThat(ConditionContext.findRestart("outer")).isSameAs(outer);
                assertThat(ConditionContext.findRestart("missing")).isNull();
                return result;
            }));
        assertThat(names).containsExactly("inner", "outer");
    }

    @Test
    void unwindingPassesThroughUnrelatedRestarts() {
        final var result = ConditionContext.withRestart("outer", outer -> {
            final var innerResult = ConditionContext.withRestart("inner", inner -> {
                outer.unwindTo();
                return "inner";
            });
            return "outer saw " + innerResult;
        });
        assertThat(result).isNull();
    }

    @Test
    void conditionSignaledFromHandlerSkipsIt() {
        final var seen = new ArrayList<String>();
        try (final var outer = new Handler(c -> seen.add("outer:" + c.condition().message()))) {
            outer.use();
            try (final var inner = new Handler(c -> {
                seen.add("inner:" + c.condition().message());
                if (c.condition().message().equals("first")) {
                    ConditionContext.signal(new TestCondition("second"));
                }
            })) {
                inner.use();
                ConditionContext.signal(new TestCondition("first"));
            }
        }
        assertThat(seen).containsExactly("inner:first", "outer:second", "outer:first");
    }

    @Test
    void tracesAreListedInnermostFirst() {
        try (final var outer = new Trace("outer")) {
            outer.use();
            try (final var inner = new Trace(() -> "inner " + 1)) {
                inner.use();
                final var messages = new ArrayList<String>();
                Trace.activeTraces().forEach(messages::add);
                assertThat(messages).containsExactly("inner 1", "outer");
            }
        }
        assertThat(Trace.activeTraces()).isEmpty();
    }

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
