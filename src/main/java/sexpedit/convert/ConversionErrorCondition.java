// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.convert;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import sexpedit.util.Trace;
import sexpedit.util.condition.Condition;

/**
 * A condition type indicating that a value could not be converted between its syntax tree and host forms.
 * <p>
 * The active traces are captured when the condition is created, so the detailed message still tells where the
 * conversion was after the stack has been unwound.
 */
public final class ConversionErrorCondition extends Condition {
    /**
     * Initializes a new conversion error with the given user-readable message.
     */
    public ConversionErrorCondition(final String message) {
        super(message);
        final var traces = new ArrayList<String>();
        Trace.activeTraces().forEach(traces::add);
        this.traces = Collections.unmodifiableList(traces);
    }

    /**
     * Retrieves the trace messages that were active when the error occurred, most recent first.
     */
    public List<String> traces() {
        return traces;
    }

    @Override
    public String detailedMessage() {
        final var builder = new StringBuilder(message());
        for (final var trace : traces) {
            builder.append("\n - ").append(trace);
        }
        return builder.toString();
    }

    private final List<String> traces;
}
