// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package tessera.style;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import tessera.css.Origin;
import tessera.css.Parser;
import tessera.css.Selector;
import tessera.css.Specificity;
import tessera.css.Stylesheet;
import tessera.dom.Document;
import tessera.util.Trace;
import tessera.util.annotation.Nullable;
import tessera.util.condition.ConditionContext;

/**
 * The style resolver.
 * <p>
 * For each element and each property the cascade picks one winning declaration among those of matching rules and the
 * element's {@code style} attribute. Candidates are ordered by precedence, then specificity, then source order, and
 * the last one wins. Precedence, from lowest: default stylesheet, author stylesheets, {@code style} attributes, then
 * {@code !important} author declarations, {@code !important} {@code style} attributes, and {@code !important}
 * default declarations.
 * <p>
 * A property no declaration sets is inherited from the parent if it's an inherited property, and takes its initial
 * value otherwise. The root element inherits from the initial style.
 */
public final class StyleResolver {
    private StyleResolver(final Document document, final List<CompiledRule> rules) {
        this.document = document;
        this.rules = rules;
    }

    /**
     * Resolves styles using the default stylesheet followed by the given author stylesheets, in order.
     */
    public static StyledDocument resolveWithDefaults(final Document document, final List<Stylesheet> authorSheets) {
        final var sheets = new ArrayList<Stylesheet>();
        sheets.add(UserAgentStylesheet.get());
        sheets.addAll(authorSheets);
        return resolve(document, sheets);
    }

    /**
     * Resolves styles using exactly the given stylesheets, in order.
     */
    public static StyledDocument resolve(final Document document, final List<Stylesheet> sheets) {
        try (final var trace = new Trace(() -> "Resolving styles of " + document.size() + " nodes")) {
            trace.use();
            final var resolver = new StyleResolver(document, compile(sheets));
            return resolver.run();
        }
    }

    private static List<CompiledRule> compile(final List<Stylesheet> sheets) {
        final var result = new ArrayList<CompiledRule>();
        for (final var sheet : sheets) {
            for (final var rule : sheet.rules()) {
                final var longhands = new ArrayList<Longhand>();
                for (final var declaration : rule.declarations()) {
                    longhands.addAll(DeclarationExpander.expand(declaration));
                }
                final var selector = rule.selector();
                result.add(new CompiledRule(selector, selector.specificity(), sheet.origin(), longhands));
            }
        }
        return result;
    }

    private StyledDocument run() {
        final var styles = new ComputedStyle[document.size()];
        styles[Document.ROOT] = ComputedStyle.initial();
        // Ids are in document order, so a parent's style is always computed before its children's.
        for (int id = 1; id < styles.length; id += 1) {
            final var parentStyle = styles[document.parent(id)];
            styles[id] = document.isElement(id) ? computeStyle(id, parentStyle) : parentStyle;
        }
        return new StyledDocument(document, styles);
    }

    private ComputedStyle computeStyle(final int element, final ComputedStyle parentStyle) {
        final var cascaded = cascade(element);
        final var builder = ComputedStyle.builder();
        var context = new Property.Context(parentStyle, parentStyle.fontSize(), parentStyle.color());
        for (final var property : Property.values()) {
            final var value = computeValue(element, property, cascaded[property.ordinal()], context);
            builder.set(property, value);
            if (property == Property.FONT_SIZE) {
                context = new Property.Context(parentStyle, (Double) value, context.color());
            } else if (property == Property.COLOR) {
                context = new Property.Context(parentStyle, context.fontSize(), (Color) value);
            }
        }
        return builder.build();
    }

    private Object computeValue(
        final int element,
        final Property property,
        final @Nullable Longhand declared,
        final Property.Context context
    ) {
        if (declared == null) {
            return property.isInherited() ? context.parent().get(property) : property.initialValue();
        }
        final var value = declared.value();
        if (value instanceof SpecifiedValue.Inherit) {
            return context.parent().get(property);
        } else if (value instanceof SpecifiedValue.Initial) {
            return property.initialValue();
        }
        final var computed = property.compute(value, context);
        if (computed == null) {
            ConditionContext.signal(new StyleFallbackCondition(property, declared.valueText(), describe(element)));
            return property.initialValue();
        }
        return computed;
    }

    // Returns the winning declaration of each property, indexed by ordinal, with nulls for undeclared properties.
    private @Nullable Longhand[] cascade(final int element) {
        final var candidates = new ArrayList<Candidate>();
        var order = 0;
        for (final var rule : rules) {
            if (SelectorMatcher.matches(document, element, rule.selector())) {
                for (final var longhand : rule.longhands()) {
                    candidates.add(new Candidate(precedence(rule.origin(), false, longhand.important()),
                        rule.specificity(), order, longhand));
                    order += 1;
                }
            } else {
                order += rule.longhands().size();
            }
        }
        final var inlineStyle = document.element(element).attributes().get("style");
        if (inlineStyle.isPresent()) {
            for (final var declaration : Parser.parseDeclarations(inlineStyle.get())) {
                for (final var longhand : DeclarationExpander.expand(declaration)) {
                    candidates.add(new Candidate(precedence(Origin.AUTHOR, true, longhand.important()),
                        Specificity.zero, order, longhand));
                    order += 1;
                }
            }
        }
        candidates.sort(candidateOrder);
        final @Nullable Longhand[] result = new Longhand[Property.values().length];
        for (final var candidate : candidates) {
            result[candidate.longhand().property().ordinal()] = candidate.longhand();
        }
        return result;
    }

    private static int precedence(final Origin origin, final boolean inline, final boolean important) {
        if (origin == Origin.USER_AGENT) {
            return important ? 5 : 0;
        }
        if (important) {
            return inline ? 4 : 3;
        }
        return inline ? 2 : 1;
    }

    private String describe(final int element) {
        final var node = document.element(element);
        final var builder = new StringBuilder("<").append(node.tagName());
        node.attributes().get("id").ifPresent(id -> builder.append(" id=\"").append(id).append('"'));
        return builder.append("> (node ").append(element).append(')').toString();
    }

    private final Document document;
    private final List<CompiledRule> rules;

    private static final Comparator<Candidate> candidateOrder = Comparator.comparingInt(Candidate::precedence)
        .thenComparing(Candidate::specificity)
        .thenComparingInt(Candidate::order);

    private record CompiledRule(Selector selector, Specificity specificity, Origin origin, List<Longhand> longhands) {
    }

    private record Candidate(int precedence, Specificity specificity, int order, Longhand longhand) {
    }
}
