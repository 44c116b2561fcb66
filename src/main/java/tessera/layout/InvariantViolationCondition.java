// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.layout;

import java.util.List;
import tessera.util.condition.Condition;

/**
 * A fatal condition signaled when a box tree violates a structural invariant, which means a bug in layout.
 * <p>
 * The detailed message lists every violation found.
 */
public final class InvariantViolationCondition extends Condition {
    InvariantViolationCondition(final List<String> violations) {
        super("Box tree verification failed with " + violations.size() + " violation(s)");
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }

    @Override
    public String detailedMessage() {
        final var builder = new StringBuilder(message());
        for (final var violation : violations) {
            builder.append("\n - ");
            builder.append(violation);
        }
        return builder.toString();
    }

    private final List<String> violations;
}
