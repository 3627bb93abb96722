package com.productcatalog.api.util;

import lombok.Builder;
import lombok.Value;

/**
 * Describes one secondary-index access pattern: which index to hit, which attributes
 * form its key, and the partition value (plus optional sort-key prefix) to match.
 */
@Value
@Builder
public class IndexQuery {

    String indexName;
    String pkField;
    String skField;
    String pkValue;

    /** Optional begins_with value on the index sort key. */
    String skPrefix;

    public boolean hasSkPrefix() {
        return skPrefix != null && !skPrefix.isEmpty();
    }
}
