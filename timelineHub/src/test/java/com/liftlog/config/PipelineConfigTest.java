package com.liftlog.config;

import com.liftlog.core.model.Row;
import com.liftlog.core.partition.DevicePartitioner;
import com.liftlog.core.rules.AttributeRule;
import com.liftlog.core.rules.ValueTransform;
import com.liftlog.plugins.trace.TraceClusterAggregator;
import com.liftlog.plugins.trace.TraceFamily;
import com.liftlog.support.TestRows;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    void defaultsShipBothTraceFamilies() {
        PipelineConfig cfg = PipelineConfig.defaults();

        assertEquals(2, cfg.trace.families.size());
        TraceFamily control = cfg.trace.families.get(0);
        assertEquals("控制", control.label());
        assertEquals("53552", control.centerId());
        assertEquals(7, control.memberIds().size());
        assertEquals(5, cfg.trace.families.get(1).memberIds().size());
        assertEquals(10, cfg.trace.secondsBefore);
        assertEquals(20, cfg.trace.secondsAfter);
        assertEquals("故障代码D240", cfg.fault.marker);
    }

    @Test
    void defaultsBindTypedTransforms() {
        Map<String, List<AttributeRule>> attrs = PipelineConfig.defaults().rules.attributes;

        assertEquals(List.of("同步楼层", "门锁信号", "运行方向"), List.copyOf(attrs.keySet()));
        assertEquals(new ValueTransform.OffsetInt(1), attrs.get("同步楼层").get(0).transform());
        assertSame(ValueTransform.Identity.INSTANCE, attrs.get("门锁信号").get(0).transform());
        assertEquals("闭合", attrs.get("门锁信号").get(0).valueMap().get("1"));
        assertInstanceOf(ValueTransform.ParseEnum.class, attrs.get("运行方向").get(0).transform());
        assertEquals(2, attrs.get("运行方向").size());
    }

    @Test
    void partialDocumentKeepsFieldDefaults() {
        PipelineConfig cfg = PipelineConfig.load(yaml("""
                rules:
                  delay:
                    thresholdMinutes: 15
                  somethingNew: true
                """));

        assertEquals(15, cfg.rules.delay.thresholdMinutes);
        assertEquals("上传延迟(分钟)", cfg.rules.delay.attribute);
        assertEquals(50, cfg.trace.timeWindowRows);
        assertEquals(List.of("控制", "管理"), cfg.trace.families.stream().map(TraceFamily::label).toList());
        assertEquals(List.of("装置心跳", "电梯心跳"), cfg.rules.nonCritical.phrases);
        assertEquals(List.of("同步楼层", "门锁信号", "运行方向"), List.copyOf(cfg.rules.attributes.keySet()));
    }

    @Test
    void tuningOnlyTheDelayKeepsTraceAggregationOn() {
        PipelineConfig cfg = PipelineConfig.load(yaml("rules: {delay: {thresholdMinutes: 10}}"));
        TraceClusterAggregator aggregator = new TraceClusterAggregator(cfg.trace, new DevicePartitioner());
        List<Row> rows = List.of(
                TestRows.row(1, "2025-12-08 10:00:00", "[x] 控制Trace: 53552"),
                TestRows.row(2, "2025-12-08 10:00:01", "控制Trace: 53553"));

        List<Row> out = aggregator.apply(rows, TestRows.HEADERS);

        assertEquals(1, out.size(), "las familias por defecto siguen activas");
        assertEquals(10, cfg.rules.delay.thresholdMinutes);
    }

    @Test
    void documentListsReplaceDefaultsWhole() {
        PipelineConfig cfg = PipelineConfig.load(yaml("""
                trace:
                  families:
                    - label: "测试"
                      centerId: "1"
                      memberIds: ["1", "2"]
                rules:
                  nonCritical:
                    phrases: ["噪声"]
                """));

        assertEquals(1, cfg.trace.families.size());
        assertEquals(List.of("噪声"), cfg.rules.nonCritical.phrases);
        assertEquals(List.of("(?i)heartbeat"), cfg.rules.nonCritical.regexes);
    }

    @Test
    void brokenDocumentFailsLoudly() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> PipelineConfig.load(yaml("rules: [unclosed")));
        assertNotNull(e.getCause());
    }

    @Test
    void unknownTransformKindIsRejected() {
        assertThrows(IllegalStateException.class, () -> PipelineConfig.load(yaml("""
                rules:
                  attributes:
                    x:
                      - keys: [a]
                        transform: { kind: eval, code: "rm -rf" }
                """)));
    }

    @Test
    void transformsBehave() {
        assertEquals(4, new ValueTransform.OffsetInt(1).apply(3));
        assertEquals(2, new ValueTransform.OffsetInt(-1).apply(" 3 "));
        assertThrows(IllegalArgumentException.class, () -> new ValueTransform.OffsetInt(1).apply(2.5));
        assertThrows(IllegalArgumentException.class, () -> new ValueTransform.OffsetInt(1).apply(true));
        assertEquals("上行", new ValueTransform.ParseEnum(Map.of("UP", "上行")).apply("UP"));
        assertThrows(IllegalArgumentException.class, () -> new ValueTransform.ParseEnum(Map.of()).apply("UP"));
        assertEquals("x", ValueTransform.Identity.INSTANCE.apply("x"));
    }

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
