package com.portablespreadsheet.app.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.portablespreadsheet.app.config.SpreadsheetProperties;
import com.portablespreadsheet.app.exceptions.GrammarException;
import com.portablespreadsheet.app.grammars.GrammarRegistry;
import com.portablespreadsheet.app.models.CellView;
import com.portablespreadsheet.app.models.SheetRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.portablespreadsheet.app.models.ExpressionRequest.cell;
import static com.portablespreadsheet.app.models.ExpressionRequest.constant;
import static com.portablespreadsheet.app.models.ExpressionRequest.of;
import static org.junit.jupiter.api.Assertions.*;

class GrammarServiceTest {

    private GrammarRegistry grammars;
    private GrammarService grammarService;

    @BeforeEach
    void setUp() {
        grammars = GrammarRegistry.withBuiltInGrammars();
        grammarService = new GrammarService(grammars);
    }

    @Test
    void testListAndGet() {
        assertEquals(List.of("excel", "python_numpy", "native"), List.copyOf(grammarService.listNotations()));
        assertEquals("=", grammarService.getGrammar("excel").at("/cells/operation/prefix").asText());
        assertThrows(GrammarException.class, () -> grammarService.getGrammar("latex"));
    }

    /**
     * The returned grammar is a copy.
     */
    @Test
    void testGrammarSourceCannotBeChanged() {
        ((ObjectNode) grammarService.getGrammar("excel").get("cells").get("operation")).put("prefix", "+");

        assertEquals("=", grammarService.getGrammar("excel").at("/cells/operation/prefix").asText());
    }

    @Test
    void testRegisterRendersNewNotation() {
        grammarService.register("latex", GrammarRegistry.loadResource("grammars/latex.json"));
        SheetService sheetService = new SheetService(grammars, new SpreadsheetProperties());
        long sheetId = sheetService.createSheet(new SheetRequest(2, 2));
        sheetService.setCellValue(sheetId, 0, 0, constant(1));

        CellView view = sheetService.setCellValue(sheetId, 1, 1, of("add", cell(0, 0), constant(2)));

        assertEquals("x_{0,0}+2", view.getWords().get("latex"));
        assertEquals(4, view.getWords().size());
    }

    @Test
    void testRemovedNotationIsNotRendered() {
        SheetService sheetService = new SheetService(grammars, new SpreadsheetProperties());
        long sheetId = sheetService.createSheet(new SheetRequest(2, 2));
        sheetService.setCellValue(sheetId, 0, 0, constant(1));

        grammarService.remove("native");

        assertFalse(sheetService.getCell(sheetId, 0, 0).getWords().containsKey("native"));
        assertThrows(GrammarException.class, () -> grammarService.remove("native"));
    }

    @Test
    void testValidate() {
        JsonNode excel = grammarService.getGrammar("excel");
        assertTrue(grammarService.validate(excel));

        ((ObjectNode) excel).remove("conditional");
        assertFalse(grammarService.validate(excel));
        assertThrows(GrammarException.class, () -> grammarService.register("broken", excel));
        assertFalse(grammarService.listNotations().contains("broken"));
    }

    @Test
    void testRegisterTakenName() {
        assertThrows(GrammarException.class, () ->
                grammarService.register("excel", GrammarRegistry.loadBundled("excel")));
    }
}
