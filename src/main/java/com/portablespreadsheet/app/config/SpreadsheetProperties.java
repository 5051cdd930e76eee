package com.portablespreadsheet.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under the "spreadsheet" prefix.
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class SpreadsheetProperties {

    // Leaves the first Excel row and column for headers (Cell (3,4) is F5)
    private boolean excelLabelOffset = true;

    // Notation name -> classpath resource of a grammar registered at startup
    private Map<String, String> extraGrammars = new LinkedHashMap<>();

    public boolean isExcelLabelOffset() {
        return excelLabelOffset;
    }

    public void setExcelLabelOffset(boolean excelLabelOffset) {
        this.excelLabelOffset = excelLabelOffset;
    }

    public Map<String, String> getExtraGrammars() {
        return extraGrammars;
    }

    public void setExtraGrammars(Map<String, String> extraGrammars) {
        this.extraGrammars = extraGrammars;
    }
}
