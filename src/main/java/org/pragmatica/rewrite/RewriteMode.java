package org.pragmatica.rewrite;

/**
 * What the caller does with the rewritten tree.
 */
public enum RewriteMode {
    /**
     * Report only: the input tree is returned unchanged.
     */
    LINT,

    /**
     * Report and apply: the rewritten tree is returned.
     */
    FORMAT
}
