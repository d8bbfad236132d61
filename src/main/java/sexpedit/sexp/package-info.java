// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Representation of S-expressions as plain Java values, without any formatting: the host-side view of a syntax
 * tree.
 */
@NonNullByDefault
package sexpedit.sexp;

import sexpedit.util.annotation.NonNullByDefault;
