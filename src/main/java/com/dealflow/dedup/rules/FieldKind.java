package com.dealflow.dedup.rules;

/**
 * Kind of text value being normalized. Rules can be scoped to specific kinds.
 */
public enum FieldKind {
    /**
     * Free text: deal names, product names.
     */
    TEXT,

    /**
     * Company names, which additionally lose trailing legal-entity suffixes.
     */
    COMPANY_NAME
}
