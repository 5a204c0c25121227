// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.assembly;

import java.util.ArrayList;
import java.util.List;
import bookbinder.document.Section;
import bookbinder.util.Trace;
import bookbinder.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Flattens a section tree into the page sequence and the navigation tree, in a single pre-order pass.
 * <p>
 * While visiting a section, its content is trimmed and cross-referenced, and the result is stored back into the
 * section. Sections are then filtered:
 * <ul>
 * <li>A section with no label can't be linked to, so it is dropped together with all of its subsections, whether
 * they have labels or not. {@link UnlabeledSectionCondition} is signaled.
 * <li>A section with no content and no subsections is dropped, signaling {@link EmptySectionCondition}.
 * <li>A section with no content but with subsections gets a list of links to its declared subsections as content.
 * </ul>
 * Both conditions are non-fatal.
 */
public final class SectionTreeWalker {
    /**
     * Initializes a walker resolving content with the given resolver and linking sections with the given scheme.
     */
    public SectionTreeWalker(final CrossReferenceResolver resolver, final LinkScheme linkScheme) {
        this.resolver = resolver;
        this.linkScheme = linkScheme;
    }

    /**
     * Flattens the trees rooted at the given sections, in order.
     */
    public FlattenedDocument flatten(final List<Section> roots) {
        final var sections = new ArrayList<Section>();
        final var navigation = new ArrayList<NavItem>();
        for (final var root : roots) {
            final var item = visit(root, sections);
            if (item != null) {
                navigation.add(item);
            }
        }
        return new FlattenedDocument(sections, navigation);
    }

    private @Nullable NavItem visit(final Section section, final List<Section> sections) {
        if (section.label() == null) {
            ConditionContext.signal(new UnlabeledSectionCondition(section));
            return null;
        }
        try (final var trace = new Trace(() -> "Flattening section " + section.identifier())) {
            trace.use();
            final var children = section.children();
            section.replaceContent(resolver.resolve(section.content().strip()));
            if (section.content().isEmpty()) {
                if (children.isEmpty()) {
                    ConditionContext.signal(new EmptySectionCondition(section));
                    return null;
                }
                section.replaceContent(renderChildListing(children));
            }
            sections.add(section);
            final var childItems = new ArrayList<NavItem>();
            for (final var child : children) {
                final var item = visit(child, sections);
                if (item != null) {
                    childItems.add(item);
                }
            }
            final var link = linkScheme.sectionAnchor(section);
            return children.isEmpty() ? new NavItem.Leaf(link) : new NavItem.Branch(link, childItems);
        }
    }

    // Lists every declared child, including those that will be filtered out later.
    private String renderChildListing(final List<Section> children) {
        final var entries = new ArrayList<String>(children.size());
        for (final var child : children) {
            final var url = linkScheme.sectionUrl(child);
            final var link = (url == null) ? child.title() : LinkScheme.markdownLink(child.title(), url);
            entries.add(child.identifier() + ": " + link);
        }
        return String.join(childListingSeparator, entries);
    }

    private static final String childListingSeparator = "\n\n";

    private final CrossReferenceResolver resolver;
    private final LinkScheme linkScheme;
}
