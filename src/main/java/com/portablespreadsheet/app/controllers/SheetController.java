package com.portablespreadsheet.app.controllers;

import com.portablespreadsheet.app.models.CellView;
import com.portablespreadsheet.app.models.ExpressionRequest;
import com.portablespreadsheet.app.models.SheetRequest;
import com.portablespreadsheet.app.models.VariableRequest;
import com.portablespreadsheet.app.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Body: { "rows": 5, "columns": 7, "rowLabels": [...], "columnLabels": [...] }
     * (labels optional). Creates a new Sheet of bare cells, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet(@RequestBody SheetRequest request) {
        long sheetId = sheetService.createSheet(request);
        return ResponseEntity.ok(sheetId);
    }

    /**
     * PUT /sheet/{sheetId}/cell/{row}/{column}
     * Body: an expression tree, e.g.
     * { "operation": "add", "arguments": [ {"operation": "cell", "row": 0, "column": 0},
     *                                      {"operation": "constant", "value": 3} ] }
     * Returns the placed cell with its text in every notation.
     */
    @PutMapping("/{sheetId}/cell/{row}/{column}")
    public ResponseEntity<CellView> setCellValue(
            @PathVariable long sheetId,
            @PathVariable int row,
            @PathVariable int column,
            @RequestBody ExpressionRequest request
    ) {
        return ResponseEntity.ok(sheetService.setCellValue(sheetId, row, column, request));
    }

    @GetMapping("/{sheetId}/cell/{row}/{column}")
    public ResponseEntity<CellView> getCell(
            @PathVariable long sheetId,
            @PathVariable int row,
            @PathVariable int column
    ) {
        return ResponseEntity.ok(sheetService.getCell(sheetId, row, column));
    }

    /**
     * GET /sheet/{sheetId}
     * Returns every cell holding a value or a computation, keyed "row,column".
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, CellView>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    @PutMapping("/{sheetId}/variable/{name}")
    public ResponseEntity<CellView> defineVariable(
            @PathVariable long sheetId,
            @PathVariable String name,
            @RequestBody VariableRequest request
    ) {
        return ResponseEntity.ok(sheetService.defineVariable(sheetId, name, request));
    }

    /**
     * DELETE /sheet/{sheetId}/row/{row}
     * Fails with 409 if a remaining cell is computed from the row.
     */
    @DeleteMapping("/{sheetId}/row/{row}")
    public ResponseEntity<Void> deleteRow(@PathVariable long sheetId, @PathVariable int row) {
        sheetService.deleteRow(sheetId, row);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{sheetId}/column/{column}")
    public ResponseEntity<Void> deleteColumn(@PathVariable long sheetId, @PathVariable int column) {
        sheetService.deleteColumn(sheetId, column);
        return ResponseEntity.noContent().build();
    }
}
