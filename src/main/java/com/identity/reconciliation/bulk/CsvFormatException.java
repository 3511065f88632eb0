package com.identity.reconciliation.bulk;

import com.identity.reconciliation.core.ReconciliationException;

/**
 * Runtime exception thrown when an input file is not well-formed CSV.
 */
public class CsvFormatException extends ReconciliationException {

    private final long lineNumber;

    public CsvFormatException(String message, long lineNumber) {
        super(message + " at line " + lineNumber);
        this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
