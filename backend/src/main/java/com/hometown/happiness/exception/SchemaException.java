package com.hometown.happiness.exception;

import java.util.List;

/** A feed is missing structurally required columns. Raised before any row is read. */
public class SchemaException extends RuntimeException {
    private final String source;
    private final List<String> missingColumns;

    public SchemaException(String source, List<String> missingColumns) {
        super(source + " missing columns: " + missingColumns);
        this.source = source;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String getSource() { return source; }
    public List<String> getMissingColumns() { return missingColumns; }
}
