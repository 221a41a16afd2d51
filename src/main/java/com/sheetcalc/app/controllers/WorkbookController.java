package com.sheetcalc.app.controllers;

import com.sheetcalc.app.models.CellValue;
import com.sheetcalc.app.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for workbooks and the formula engine.
 * "/workbook" is the base path.
 */
@RestController
@RequestMapping("/workbook")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /workbook
     * Body: { "sheets": ["Sheet1", "Data"] }. Returns the new workbook's ID.
     */
    @PostMapping
    public ResponseEntity<Long> createWorkbook(@RequestBody(required = false) Map<String, List<String>> request) {
        List<String> sheets = request == null ? null : request.get("sheets");
        long workbookId = workbookService.createWorkbook(sheets);
        return ResponseEntity.ok(workbookId);
    }

    /**
     * PUT /workbook/{workbookId}/sheet/{sheetName}/cell/{reference}
     * Body: raw cell input, e.g. "42", "hello" or "=SUM(A1:A3)".
     * An invalid formula is rejected with a 400 and leaves the cell as it was.
     */
    @PutMapping("/{workbookId}/sheet/{sheetName}/cell/{reference}")
    public ResponseEntity<Void> setCellValue(
            @PathVariable long workbookId,
            @PathVariable String sheetName,
            @PathVariable String reference,
            @RequestBody(required = false) String rawValue
    ) {
        workbookService.setCellValue(workbookId, sheetName, reference, rawValue);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /workbook/{workbookId}/sheet/{sheetName}
     * Returns { "A1": 42.0, "B1": "hello", ... }.
     */
    @GetMapping("/{workbookId}/sheet/{sheetName}")
    public ResponseEntity<Map<String, Object>> getSheet(@PathVariable long workbookId,
                                                        @PathVariable String sheetName) {
        return ResponseEntity.ok(workbookService.getSheetData(workbookId, sheetName));
    }

    /**
     * POST /workbook/{workbookId}/evaluate
     * Body: { "sheet": "Sheet1", "formula": "=A1*2" }.
     * Returns { "type": "NUMBER", "value": 84.0 }. Nothing is stored.
     */
    @PostMapping("/{workbookId}/evaluate")
    public ResponseEntity<Map<String, Object>> evaluate(@PathVariable long workbookId,
                                                        @RequestBody Map<String, String> request) {
        CellValue result = workbookService.evaluateFormula(workbookId, request.get("sheet"), request.get("formula"));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", result.getType().name());
        body.put("value", result.toDisplayValue());
        return ResponseEntity.ok(body);
    }

    /**
     * POST /workbook/{workbookId}/calculate
     * Recalculates every formula cell. A circular reference is a 400 and
     * leaves all cached results unchanged.
     */
    @PostMapping("/{workbookId}/calculate")
    public ResponseEntity<Void> calculate(@PathVariable long workbookId) {
        workbookService.calculateAll(workbookId);
        return ResponseEntity.ok().build();
    }
}
