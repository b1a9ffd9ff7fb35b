// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import gisp.diagnostic.CompilationErrorCondition;
import gisp.diagnostic.Stage;
import gisp.sexp.Sexp;
import gisp.sexp.Sexps;

/**
 * A condition type indicating that a well-formed S-expression has no Java counterpart, for example because a special
 * form got the wrong number of arguments.
 */
public final class LoweringErrorCondition extends CompilationErrorCondition {
    LoweringErrorCondition(final String message, final Sexp form) {
        super(Stage.LOWER, form.position(), message);
        this.form = Sexps.print(form);
    }

    @Override
    public String form() {
        return form;
    }

    @Override
    public String detailedMessage() {
        return super.detailedMessage() + "\nIn form: " + form;
    }

    private final String form;
}
