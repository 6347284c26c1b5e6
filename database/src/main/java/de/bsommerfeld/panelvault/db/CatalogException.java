package de.bsommerfeld.panelvault.db;

/**
 * Unchecked failure of the catalog store. A failed commit leaves nothing
 * partially visible.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
