// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package bookbinder.document;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import bookbinder.io.FileOperations;
import bookbinder.util.Trace;
import bookbinder.util.UnreachableCodeReachedError;
import bookbinder.util.condition.ConditionContext;
import bookbinder.util.condition.UnhandledErrorError;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reads the JSON document interchange format into a {@link ParsedDocument}.
 * <p>
 * The format is a direct rendition of the parser's output:
 * <pre>{@code
 * {
 *   "sections": [{"id": "1", "title": "Intro", "label": "intro", "content": "...", "children": [...]}],
 *   "labels": {"eq:1": {"kind": "item", "ordinal": "1"}},
 *   "definitions": {"foo": "Foo means bar."}
 * }
 * }</pre>
 * Besides the explicit {@code labels}, each labeled section is reachable by its own label, and each definition by
 * {@code def:} followed by its name. Explicit entries win over these implicit ones.
 * <p>
 * On error, a fatal condition is signaled:
 * <ul>
 * <li>{@link bookbinder.io.FileOperationErrorCondition} if the file can't be read.
 * <li>{@link DocumentLoadErrorCondition} if the file isn't JSON of the expected shape, for example has unknown fields.
 * <li>{@link SectionLinkingErrorCondition} if sections lack identifiers or titles, identifiers or labels repeat, a
 * section or label entry is empty, a label lacks its target field, or a section label points nowhere.
 * </ul>
 */
public final class DocumentLoader {
    /**
     * Initializes a new loader reading documents through the given file operations.
     */
    public DocumentLoader(final FileOperations files) {
        this.files = files;
        mapper = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    }

    /**
     * Loads the document stored at the given path.
     */
    public ParsedDocument load(final Path path) {
        try (final var trace = new Trace(() -> "Loading document from " + path)) {
            trace.use();
            final var text = files.readString(path);
            final @Nullable DocumentSpec spec;
            try {
                spec = mapper.readValue(text, DocumentSpec.class);
            } catch (final JsonProcessingException e) {
                throw ConditionContext.error(new DocumentLoadErrorCondition(path, e));
            }
            if (spec == null) {
                throw Linker.signalError("Document " + path + " is null");
            }
            return new Linker().link(spec);
        }
    }

    private final FileOperations files;
    private final ObjectMapper mapper;

    private static final class Linker {
        private ParsedDocument link(final DocumentSpec spec) {
            final var roots = new ArrayList<Section>();
            for (final var sectionSpec : orEmpty(spec.sections())) {
                if (sectionSpec == null) {
                    throw signalError("The document root contains an empty section entry");
                }
                roots.add(buildSection(sectionSpec, "(document root)"));
            }
            final var labels = new LinkedHashMap<String, Label>();
            sectionsByLabel.forEach((label, section) -> labels.put(label, new Label.SectionRef(section)));
            final var definitions = spec.definitions() == null ? Map.<String, String>of() : spec.definitions();
            for (final var entry : definitions.entrySet()) {
                final var name = entry.getKey();
                if (entry.getValue() == null) {
                    throw signalError("Definition " + name + " has no text");
                }
                labels.put(definitionLabelPrefix + name, new Label.DefinitionRef(name));
            }
            final var explicitLabels = spec.labels() == null ? Map.<String, LabelSpec>of() : spec.labels();
            explicitLabels.forEach((id, labelSpec) -> labels.put(id, toLabel(id, labelSpec)));
            return new ParsedDocument(roots, LabelTable.of(labels), DefinitionTable.of(definitions));
        }

        private Section buildSection(final SectionSpec spec, final String parentIdentifier) {
            final var identifier = spec.id();
            if (identifier == null || identifier.isEmpty()) {
                throw signalError("A section below " + parentIdentifier + " has no identifier");
            }
            if (spec.title() == null) {
                throw signalError("Section " + identifier + " has no title");
            }
            final var children = new ArrayList<Section>();
            for (final var childSpec : orEmpty(spec.children())) {
                if (childSpec == null) {
                    throw signalError("Section " + identifier + " contains an empty child entry");
                }
                children.add(buildSection(childSpec, identifier));
            }
            final var content = spec.content() == null ? "" : spec.content();
            final var section = new Section(identifier, spec.title(), content, spec.label(), children);
            if (sectionsById.putIfAbsent(identifier, section) != null) {
                throw signalError("Section identifier " + identifier + " is used more than once");
            }
            final var label = spec.label();
            if (label != null) {
                final var previous = sectionsByLabel.putIfAbsent(label, section);
                if (previous != null) {
                    throw signalError(
                        "Label " + label + " is used by both section " + previous.identifier() + " and " + identifier
                    );
                }
            }
            return section;
        }

        private Label toLabel(final String id, final @Nullable LabelSpec spec) {
            if (spec == null) {
                throw signalError("Label " + id + " has no target");
            } else if (spec instanceof final SectionLabelSpec sectionLabel) {
                final var sectionIdentifier = required(id, "section", sectionLabel.section());
                final var section = sectionsById.get(sectionIdentifier);
                if (section == null) {
                    throw signalError("Label " + id + " refers to unknown section " + sectionIdentifier);
                }
                return new Label.SectionRef(section);
            } else if (spec instanceof final DefinitionLabelSpec definitionLabel) {
                return new Label.DefinitionRef(required(id, "name", definitionLabel.name()));
            } else if (spec instanceof final ItemLabelSpec itemLabel) {
                return new Label.ItemRef(required(id, "ordinal", itemLabel.ordinal()));
            } else {
                throw new UnreachableCodeReachedError();
            }
        }

        private static String required(final String labelId, final String field, final @Nullable String value) {
            if (value == null) {
                throw signalError("Label " + labelId + " has no " + field);
            }
            return value;
        }

        private static <T> List<T> orEmpty(final @Nullable List<T> list) {
            return (list == null) ? List.of() : list;
        }

        private static UnhandledErrorError signalError(final String message) {
            return ConditionContext.error(new SectionLinkingErrorCondition(message));
        }

        // Sections are registered children first, which doesn't matter for lookups.
        private final Map<String, Section> sectionsById = new HashMap<>();
        private final Map<String, Section> sectionsByLabel = new LinkedHashMap<>();
    }

    private static final String definitionLabelPrefix = "def:";

    private record DocumentSpec(
        @Nullable List<@Nullable SectionSpec> sections,
        @Nullable Map<String, LabelSpec> labels,
        @Nullable Map<String, String> definitions
    ) {
    }

    private record SectionSpec(
        @Nullable String id,
        @Nullable String title,
        @Nullable String content,
        @Nullable String label,
        @Nullable List<@Nullable SectionSpec> children
    ) {
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = SectionLabelSpec.class, name = "section"),
        @JsonSubTypes.Type(value = DefinitionLabelSpec.class, name = "definition"),
        @JsonSubTypes.Type(value = ItemLabelSpec.class, name = "item"),
    })
    private sealed interface LabelSpec permits SectionLabelSpec, DefinitionLabelSpec, ItemLabelSpec {
    }

    private record SectionLabelSpec(@Nullable String section) implements LabelSpec {
    }

    private record DefinitionLabelSpec(@Nullable String name) implements LabelSpec {
    }

    private record ItemLabelSpec(@Nullable String ordinal) implements LabelSpec {
    }
}
