package com.vedicchart.common.exception;

/**
 * Raised when a body, sign or house identifier does not resolve against its catalog.
 */
public class CatalogLookupException extends RuntimeException {
    private final String catalog;
    private final String identifier;

    public CatalogLookupException(String catalog, String identifier) {
        super("[" + catalog + "] unknown identifier: " + identifier);
        this.catalog = catalog;
        this.identifier = identifier;
    }

    public String getCatalog() {
        return catalog;
    }

    public String getIdentifier() {
        return identifier;
    }
}
