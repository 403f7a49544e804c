package com.shelf.matching.rules;

/**
 * Kind of catalog text a normalization rule may be scoped to.
 */
public enum TextField {
    BRAND,
    TITLE,
    STORE_NAME
}
