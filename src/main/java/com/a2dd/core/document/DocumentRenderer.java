package com.a2dd.core.document;

import com.a2dd.core.model.PlayDescriptor;

import java.util.List;

/**
 * Writes converted orchestrations back to text, attaching each directive's comment
 * as a leading comment block.
 */
public interface DocumentRenderer {

    String render(List<PlayDescriptor> plays);

    /**
     * Block-style dump of an arbitrary value, used for audit comments.
     */
    String dumpBlock(Object value);
}
