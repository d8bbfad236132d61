// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.convert;

import sexpedit.tree.Node;

/**
 * A bidirectional mapping between syntax tree nodes and host-level values of type {@code V}.
 * <p>
 * Both directions must be pure. A value or node that has no counterpart on the other side is reported by signaling
 * a fatal {@link ConversionErrorCondition}, never by returning {@code null}.
 *
 * @param <V> the host value type
 */
public interface Converter<V> {
    /**
     * Returns a node representing the given host value.
     */
    Node toNode(V value);

    /**
     * Returns the host value the given node represents, ignoring any formatting inside it.
     */
    V toHostValue(Node node);
}
