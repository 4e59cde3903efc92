// file: core/src/main/java/io/schemasync/core/BackendException.java
package io.schemasync.core;

/** The backend driver failed to run a statement. Carries the statement text. */
public class BackendException extends SchemaSyncException {

    private final String statement;

    public BackendException(String statement, Throwable cause) {
        super("statement failed: " + cause.getMessage() + " [" + statement.strip() + "]", cause);
        this.statement = statement;
    }

    public String statement() {
        return statement;
    }
}
