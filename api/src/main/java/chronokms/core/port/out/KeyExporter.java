package chronokms.core.port.out;

import java.security.Key;

/**
 * Converts in-memory key handles into a portable, transmissible representation.
 */
public interface KeyExporter {

    /**
     * Export a key as structured key material.
     *
     * @param key the key handle
     * @return the portable representation
     */
    String export(Key key);
}
