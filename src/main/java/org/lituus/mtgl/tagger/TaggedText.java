package org.lituus.mtgl.tagger;

import org.lituus.mtgl.catalog.Category;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tagging of one ability line. Spans are contiguous and in source order, so their texts
 * concatenate back to the source exactly.
 */
public record TaggedText(String source, List<TaggedSpan> spans) {
    public TaggedText {
        spans = List.copyOf(spans);
    }

    public String reconstruct() {
        return spans.stream().map(TaggedSpan::text).collect(Collectors.joining());
    }

    public List<TaggedSpan> spans(Category category) {
        return spans.stream().filter(s -> s.category() == category).toList();
    }

    public String render() {
        return spans.stream().map(TaggedSpan::render).collect(Collectors.joining());
    }

    @Override
    public String toString() {
        return render();
    }
}
