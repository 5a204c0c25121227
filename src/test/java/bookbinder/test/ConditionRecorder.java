// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.test;

import java.util.ArrayList;
import java.util.List;
import bookbinder.util.condition.Condition;
import bookbinder.util.condition.Handler;
import bookbinder.util.condition.SignaledCondition;

// Collects non-fatal conditions signaled while it's open. Fatal ones are left to propagate.
final class ConditionRecorder implements AutoCloseable {
    ConditionRecorder() {
        handler = new Handler(this::record);
    }

    List<Condition> conditions() {
        return List.copyOf(conditions);
    }

    <C extends Condition> List<C> conditionsOfType(final Class<C> type) {
        final var result = new ArrayList<C>();
        for (final var condition : conditions) {
            if (type.isInstance(condition)) {
                result.add(type.cast(condition));
            }
        }
        return result;
    }

    @Override
    public void close() {
        handler.close();
    }

    private void record(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            conditions.add(condition.condition());
        }
    }

    private final Handler handler;
    private final List<Condition> conditions = new ArrayList<>();
}
