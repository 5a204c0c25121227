// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.assembly;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import bookbinder.document.Label;
import bookbinder.document.LabelTable;
import bookbinder.util.UnreachableCodeReachedError;
import bookbinder.util.condition.ConditionContext;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * Replaces inline cross-reference markers with links.
 * <p>
 * Two kinds of markers are recognized:
 * <ul>
 * <li>{@code ~~~id~~~} becomes a markdown link with human-readable text, like {@code [Introduction](intro.html)}.
 * <li>{@code ~~id~~} becomes the bare url, like {@code intro.html}, for use inside hand-written markup.
 * </ul>
 * Numbered items have no url, so both forms yield their ordinal.
 * <p>
 * Link markers are replaced first, in one pass over the whole text, then url markers in a second pass. Neither pass
 * looks at its own output. An id missing from the label table signals an {@link UnresolvedReferenceCondition} and is
 * left in the text verbatim.
 */
public final class CrossReferenceResolver {
    /**
     * Initializes a resolver looking ids up in the given table and building urls with the given scheme.
     */
    public CrossReferenceResolver(final LabelTable labels, final LinkScheme linkScheme) {
        this.labels = labels;
        this.linkScheme = linkScheme;
    }

    /**
     * Returns the given text with every marker replaced.
     */
    @CheckReturnValue
    public String resolve(final String text) {
        final var linked = replaceMarkers(linkMarker, text, this::resolveLink);
        return replaceMarkers(urlMarker, linked, this::resolveUrl);
    }

    private String resolveLink(final String referenceId) {
        final var label = labels.get(referenceId);
        if (label instanceof final Label.SectionRef sectionRef) {
            final var url = linkScheme.sectionUrl(sectionRef.section());
            return (url == null)
                ? unresolved(referenceId)
                : LinkScheme.markdownLink(sectionRef.section().title(), url);
        } else if (label instanceof final Label.DefinitionRef definitionRef) {
            final var name = definitionRef.name();
            return LinkScheme.markdownLink(name, linkScheme.definitionUrl(name));
        } else if (label instanceof final Label.ItemRef itemRef) {
            return itemRef.ordinal();
        } else if (label == null) {
            return unresolved(referenceId);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private String resolveUrl(final String referenceId) {
        final var label = labels.get(referenceId);
        if (label instanceof final Label.SectionRef sectionRef) {
            final var url = linkScheme.sectionUrl(sectionRef.section());
            return (url == null) ? unresolved(referenceId) : url;
        } else if (label instanceof final Label.DefinitionRef definitionRef) {
            return linkScheme.definitionUrl(definitionRef.name());
        } else if (label instanceof final Label.ItemRef itemRef) {
            return itemRef.ordinal();
        } else if (label == null) {
            return unresolved(referenceId);
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private static String unresolved(final String referenceId) {
        ConditionContext.signal(new UnresolvedReferenceCondition(referenceId));
        return referenceId;
    }

    private static String replaceMarkers(
        final Pattern pattern,
        final String text,
        final Function<String, String> replacement
    ) {
        return pattern.matcher(text).replaceAll(match -> Matcher.quoteReplacement(replacement.apply(match.group(1))));
    }

    private static final Pattern linkMarker = Pattern.compile("~~~([^~]+)~~~");
    private static final Pattern urlMarker = Pattern.compile("~~([^~]+)~~");

    private final LabelTable labels;
    private final LinkScheme linkScheme;
}
