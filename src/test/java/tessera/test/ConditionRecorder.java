// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import tessera.util.condition.Condition;
import tessera.util.condition.Handler;
import tessera.util.condition.HandlerProcedure;

/**
 * Records every condition signaled while it's open, declining to handle any of them. Thread-safe, so it also sees
 * conditions signaled by worker threads that inherit the condition state.
 */
final class ConditionRecorder implements AutoCloseable {
    ConditionRecorder() {
        handler = new Handler((HandlerProcedure.ThreadSafe) condition -> conditions.add(condition.condition()));
    }

    List<Condition> all() {
        return List.copyOf(conditions);
    }

    <T extends Condition> List<T> ofType(final Class<T> type) {
        return conditions.stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Override
    public void close() {
        handler.close();
    }

    private final CopyOnWriteArrayList<Condition> conditions = new CopyOnWriteArrayList<>();
    private final Handler handler;
}
