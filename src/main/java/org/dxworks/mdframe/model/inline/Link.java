package org.dxworks.mdframe.model.inline;

import java.util.List;

/**
 * A resolved link. {@code label} is the raw text the reference was looked up by, null for inline links;
 * {@code title} is null when absent.
 */
public record Link(List<Inline> children, String destination, String title, LinkForm form,
                   String label) implements Inline {

    public Link {
        children = List.copyOf(children);
    }
}
