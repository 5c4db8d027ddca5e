package org.dxworks.mdframe.model.inline;

/**
 * How a link or image was written.
 */
public enum LinkForm {
    /** {@code [text](destination "title")} */
    INLINE,
    /** {@code [text][label]} */
    FULL_REFERENCE,
    /** {@code [text][]} */
    COLLAPSED_REFERENCE,
    /** {@code [text]} */
    SHORTCUT_REFERENCE
}
