package com.liftlog.core.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SheetHeadersTest {

    @Test
    void firstMatchingHeaderWins() {
        SheetHeaders headers = SheetHeaders.of("装置时间", "合同号", "上传时间", "信息内容", "备注内容");

        assertEquals(Optional.of("装置时间"), headers.timeColumn());
        assertEquals(Optional.of("信息内容"), headers.contentColumn());
        assertEquals(Optional.empty(), headers.typeColumn());
    }

    @Test
    void englishHeadersMatchIgnoringCase() {
        SheetHeaders headers = SheetHeaders.of("Device Time", "Contract", "Event Type", "Content");

        assertEquals(Optional.of("Device Time"), headers.timeColumn());
        assertEquals(Optional.of("Event Type"), headers.typeColumn());
        assertEquals(Optional.of("Content"), headers.contentColumn());
    }

    @Test
    void deviceColumnIsSecondHeader() {
        assertEquals(Optional.of("合同号"), SheetHeaders.of("时间", "合同号").deviceColumn());
        assertEquals(Optional.empty(), SheetHeaders.of("时间").deviceColumn());
    }
}
