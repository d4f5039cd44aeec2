package com.liftlog.core.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tablas del motor de reglas (etiquetas + atributos globales). Se llena desde la sección
 * {@code rules:} del YAML de pipeline.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleConfig {
    public NonCriticalConfig nonCritical = new NonCriticalConfig();
    public DelayConfig delay = new DelayConfig();
    public HumanOperationConfig humanOperation = new HumanOperationConfig();
    public WorkOrderConfig workOrder = new WorkOrderConfig();
    public LabelConfig labels = new LabelConfig();

    /** atributo → reglas en orden; gana la primera que produce un valor. */
    public Map<String, List<AttributeRule>> attributes = defaultAttributes();

    private static Map<String, List<AttributeRule>> defaultAttributes() {
        Map<String, List<AttributeRule>> m = new LinkedHashMap<>();
        // el controlador reporta el piso 0-based
        m.put("同步楼层", List.of(new AttributeRule(
                List.of("syncFloor", "sync_floor", "同步楼层"), null, new ValueTransform.OffsetInt(1))));
        m.put("门锁信号", List.of(new AttributeRule(
                List.of("doorLock", "door_lock", "门锁"), Map.<String, Object>of("0", "断开", "1", "闭合"), null)));
        m.put("运行方向", List.of(
                new AttributeRule(List.of("direction", "dir"), null,
                        new ValueTransform.ParseEnum(Map.of("UP", "上行", "DOWN", "下行", "STOP", "停止"))),
                AttributeRule.of("运行方向")));
        return m;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NonCriticalConfig {
        public List<String> phrases = new ArrayList<>(List.of("装置心跳", "电梯心跳"));
        public List<String> regexes = new ArrayList<>(List.of("(?i)heartbeat"));
        public String reason = "Matched non-critical keyword/regex";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DelayConfig {
        /** Se etiqueta solo si el retraso supera estrictamente este valor. */
        public int thresholdMinutes = 5;
        /** Nombre del atributo derivado (minutos enteros, solo si > 0). */
        public String attribute = "上传延迟(分钟)";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HumanOperationConfig {
        public List<String> phrases = new ArrayList<>(List.of("检修", "机修工单"));
        // heurística "morado": R > minRed, B > minBlue, G < maxGreen
        public int minRed = 100;
        public int minBlue = 100;
        public int maxGreen = 100;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WorkOrderConfig {
        public String phrase = "工单";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LabelConfig {
        public String nonCritical = "[非关键]";
        /** Formato con un %d para los minutos. */
        public String delayedUpload = "[⏳延迟上传%d分钟]";
        public String humanOperation = "[👷人为操作]";
        public String workOrder = "[📋工单]";
        public String attributesLine = ">> 全局属性: ";
        public String attributesIndent = "    ";
    }
}
