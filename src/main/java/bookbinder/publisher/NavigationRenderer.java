// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.publisher;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import bookbinder.assembly.LinkScheme;
import bookbinder.assembly.NavItem;
import bookbinder.dom.Node;
import bookbinder.dom.Serializer;
import bookbinder.dom.Tag;
import bookbinder.io.FileOperations;
import bookbinder.util.Trace;
import bookbinder.util.UnreachableCodeReachedError;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;

/**
 * Renders the navigation tree as nested unordered lists.
 * <p>
 * Each entry becomes a list item holding its link; a branch additionally holds a nested list of its children.
 */
public final class NavigationRenderer {
    /**
     * Initializes a renderer writing through the given file operations.
     */
    public NavigationRenderer(final FileOperations files) {
        this.files = files;
    }

    /**
     * Returns the markup of the given navigation forest.
     */
    @CheckReturnValue
    public static String render(final List<NavItem> items) {
        return Serializer.serializeToString(renderList(items));
    }

    /**
     * Writes the navigation index of the given forest into the given directory.
     *
     * @return The path of the written index.
     */
    public Path write(final List<NavItem> items, final Path directory) {
        try (final var trace = new Trace("Building the navigation index")) {
            trace.use();
            final var path = directory.resolve(LinkScheme.navigationFileName);
            files.writeString(path, render(items));
            return path;
        }
    }

    private static Node.Element renderList(final List<NavItem> items) {
        final var listItems = new ArrayList<Node>(items.size());
        for (final var item : items) {
            listItems.add(renderItem(item));
        }
        return Node.simple(Tag.UL, listItems);
    }

    private static Node.Element renderItem(final NavItem item) {
        if (item instanceof final NavItem.Leaf leaf) {
            return Node.simple(Tag.LI, leaf.link());
        } else if (item instanceof final NavItem.Branch branch) {
            return Node.simple(Tag.LI, List.of(branch.link(), renderList(branch.children())));
        } else {
            throw new UnreachableCodeReachedError();
        }
    }

    private final FileOperations files;
}
