package org.dxworks.mdframe.model.inline;

import java.util.List;

/**
 * A resolved image; {@code description} holds the inline content between {@code ![} and {@code ]}.
 */
public record Image(List<Inline> description, String destination, String title, LinkForm form,
                    String label) implements Inline {

    public Image {
        description = List.copyOf(description);
    }
}
