package com.spreadpool.dto;

import java.util.ArrayList;
import java.util.List;

public class PropImportResult {
    private boolean success;
    private int imported;
    private int rowsTotal;
    private List<String> errors = new ArrayList<>();

    public static PropImportResult of(int rowsTotal, int imported, List<String> errors) {
        PropImportResult r = new PropImportResult();
        r.rowsTotal = rowsTotal;
        r.imported = imported;
        if (errors != null) r.errors = errors;
        r.success = r.errors.isEmpty();
        return r;
    }

    public boolean isSuccess() { return success; }
    public int getImported() { return imported; }
    public int getRowsTotal() { return rowsTotal; }
    public List<String> getErrors() { return errors; }
}
