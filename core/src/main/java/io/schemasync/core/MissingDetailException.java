// file: core/src/main/java/io/schemasync/core/MissingDetailException.java
package io.schemasync.core;

/** The detail fetch for a constructed live node returned no row. */
public class MissingDetailException extends DivergenceException {

    public MissingDetailException(String path) {
        super(path, "detail query returned nothing for an object expected to exist");
    }
}
