package com.flagship.general_ledger.sequence;

/**
 * Tables that hold a numbering counter.
 */
public enum NumberingScope {
    VOUCHER("voucher_types", "Voucher type"),
    DOCUMENT("document_types", "Document type");

    private final String table;
    private final String label;

    NumberingScope(String table, String label) {
        this.table = table;
        this.label = label;
    }

    String table() {
        return table;
    }

    public String label() {
        return label;
    }
}
