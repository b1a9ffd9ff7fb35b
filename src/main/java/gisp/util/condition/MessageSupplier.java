// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.util.condition;

/**
 * Produces a trace message on demand, so traces that never end up in a diagnostic cost no string building.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
