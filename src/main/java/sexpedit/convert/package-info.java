// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Conversion between syntax tree nodes and host-level values, used by the edit layer.
 */
@NonNullByDefault
package sexpedit.convert;

import sexpedit.util.annotation.NonNullByDefault;
