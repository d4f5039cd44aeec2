package com.liftlog.core.rules;

import com.liftlog.core.model.Cell;
import com.liftlog.core.model.Row;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommentPayloadExtractorTest {

    private final CommentPayloadExtractor extractor = new CommentPayloadExtractor();

    @Test
    void strictJsonInsideFreeText() {
        Map<String, Object> payload = extractor.parse("楼层信息:\n{\"syncFloor\": 3,\n \"doorLock\": 1}\n-- 张工");

        assertEquals(3, payload.get("syncFloor"));
        assertEquals(1, payload.get("doorLock"));
    }

    @Test
    void pythonStyleLiteralsAreRelaxed() {
        Map<String, Object> payload = extractor.parse("{'syncFloor': 2, 'ok': True, 'blocked': False, 'note': None}");

        assertEquals(2, payload.get("syncFloor"));
        assertEquals(Boolean.TRUE, payload.get("ok"));
        assertEquals(Boolean.FALSE, payload.get("blocked"));
        assertTrue(payload.containsKey("note"));
        assertNull(payload.get("note"));
    }

    @Test
    void malformedPayloadYieldsEmptyMap() {
        assertEquals(Map.of(), extractor.parse("{syncFloor: 2"));
        assertEquals(Map.of(), extractor.parse("{syncFloor = 2}"));
        assertEquals(Map.of(), extractor.parse("sin llaves"));
        assertEquals(Map.of(), extractor.parse(""));
        assertEquals(Map.of(), extractor.parse(null));
    }

    @Test
    void textAfterTheObjectMakesItMalformed() {
        // el tramo va de la primera '{' a la última '}': dos objetos con texto en medio no son JSON
        assertEquals(Map.of(), extractor.parse("{\"syncFloor\": 2} 备注 {\"doorLock\": 1}"));
        assertEquals(Map.of(), extractor.parse("{'syncFloor': 2} 备注 {'doorLock': 1}"));
    }

    @Test
    void commentsOfAllCellsAreConsidered() {
        Row row = Row.builder().id(1)
                .cell("时间", new Cell("2025-12-08 10:00:00", null, null))
                .cell("内容", new Cell("检修", null, "{\"doorLock\": 0}"))
                .build();

        assertEquals(Map.of("doorLock", 0), extractor.extract(row));
    }
}
