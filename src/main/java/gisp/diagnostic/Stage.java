// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.diagnostic;

/**
 * The transpiler stage that detected an error.
 */
public enum Stage {
    LEX("lex"),
    PARSE("parse"),
    LOWER("lowering");

    Stage(final String displayName) {
        this.displayName = displayName;
    }

    /**
     * Retrieves the user-readable name of this stage, as used in diagnostics.
     */
    public String displayName() {
        return displayName;
    }

    private final String displayName;
}
