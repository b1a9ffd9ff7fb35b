// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package gisp.lowering;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import gisp.util.annotation.Nullable;

/**
 * A read-only registry of special forms, keyed by head symbol name.
 */
public final class SpecialForms {
    private SpecialForms(final Map<String, SpecialForm> forms) {
        this.forms = Map.copyOf(forms);
    }

    /**
     * Returns the registry of all built-in special forms.
     */
    public static SpecialForms standard() {
        return STANDARD;
    }

    /**
     * Returns a builder starting from an empty registry.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the special form registered under the given name, or {@code null} if there's none.
     */
    public @Nullable SpecialForm lookup(final String name) {
        return forms.get(name);
    }

    public Set<String> names() {
        return forms.keySet();
    }

    private final Map<String, SpecialForm> forms;

    private static final SpecialForms STANDARD = createStandard();

    private static SpecialForms createStandard() {
        final var builder = builder();
        DeclarationForms.register(builder);
        ControlForms.register(builder);
        OperatorForms.register(builder);
        return builder.build();
    }

    /**
     * A builder of special form registries. Registering two forms with the same name is an error.
     */
    public static final class Builder {
        private Builder() {
        }

        public Builder add(final SpecialForm form) {
            if (forms.putIfAbsent(form.name(), form) != null) {
                throw new IllegalArgumentException("Special form " + form.name() + " is already registered");
            }
            return this;
        }

        public Builder declaration(final String name, final Arity arity, final SpecialForm.DeclarationRule rule) {
            return add(new SpecialForm.DeclarationForm(name, arity, rule));
        }

        public Builder expression(final String name, final Arity arity, final SpecialForm.ExpressionRule rule) {
            return add(new SpecialForm.ExpressionForm(name, arity, rule));
        }

        public SpecialForms build() {
            return new SpecialForms(forms);
        }

        private final Map<String, SpecialForm> forms = new HashMap<>();
    }
}
