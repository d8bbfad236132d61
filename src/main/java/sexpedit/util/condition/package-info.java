// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system, used to report conversion failures to whoever is driving an
 * edit, before the stack unwinds.
 */
@NonNullByDefault
package sexpedit.util.condition;

import sexpedit.util.annotation.NonNullByDefault;
