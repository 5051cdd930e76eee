package com.portablespreadsheet.app.exceptions;

/**
 * Thrown for a sheet ID that no sheet was created under.
 */
public class SheetNotFoundException extends RuntimeException {

    private final long sheetId;

    public SheetNotFoundException(long sheetId) {
        super("Sheet not found: " + sheetId);
        this.sheetId = sheetId;
    }

    public long getSheetId() {
        return sheetId;
    }
}
