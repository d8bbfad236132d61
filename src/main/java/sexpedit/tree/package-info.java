// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The format-preserving syntax tree: composite forms, tokens, and the whitespace and comments between them.
 */
@NonNullByDefault
package sexpedit.tree;

import sexpedit.util.annotation.NonNullByDefault;
