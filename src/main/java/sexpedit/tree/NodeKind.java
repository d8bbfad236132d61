// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sexpedit.tree;

/**
 * The kind tag of a {@link Node}.
 */
public enum NodeKind {
    LIST("list"),
    VECTOR("vector"),
    SET("set"),
    MAP("map"),
    TOKEN("token"),
    WHITESPACE("whitespace"),
    COMMENT("comment"),
    PLACEHOLDER("placeholder");

    NodeKind(final String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns {@code true} iff nodes of this kind only carry formatting, that is, they are whitespace or comments.
     */
    public boolean isInsignificant() {
        return this == WHITESPACE || this == COMMENT;
    }

    @Override
    public String toString() {
        return displayName;
    }

    private final String displayName;
}
