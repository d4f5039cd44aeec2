package com.liftlog.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.liftlog.core.rules.RuleConfig;
import com.liftlog.plugins.trace.TraceFamily;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuración completa del pipeline. Se carga de YAML y es de solo lectura una vez cargada;
 * puede compartirse entre ejecuciones concurrentes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfig {
    /** Documento por defecto en el classpath. */
    public static final String DEFAULT_RESOURCE = "/timeline-rules.yml";

    public TraceConfig trace = new TraceConfig();
    public FaultConfig fault = new FaultConfig();
    public RuleConfig rules = new RuleConfig();

    public static PipelineConfig defaults() {
        try (InputStream in = PipelineConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static PipelineConfig load(InputStream yaml) {
        try {
            ObjectMapper om = new ObjectMapper(new YAMLFactory());
            PipelineConfig cfg = om.readValue(yaml, PipelineConfig.class);
            return cfg != null ? cfg : new PipelineConfig();
        } catch (Exception e) {
            throw new IllegalStateException("Error loading timeline rules", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TraceConfig {
        /** Control (53552..53558) y gestión (53504..53508); un YAML que trae la lista la reemplaza entera. */
        public List<TraceFamily> families = new ArrayList<>(List.of(
                new TraceFamily("控制", "53552", List.of("53552", "53553", "53554", "53555", "53556", "53557", "53558")),
                new TraceFamily("管理", "53504", List.of("53504", "53505", "53506", "53507", "53508"))));

        // —— ventana por tiempo (cuando la hora del centro se puede parsear) ——
        /** Segundos antes del centro que todavía cuentan. */
        public int secondsBefore = 10;
        /** Segundos después del centro que todavía cuentan. */
        public int secondsAfter = 20;
        /** Filas a cada lado del centro que se revisan. */
        public int timeWindowRows = 50;

        // —— ventana por filas (sin hora utilizable) ——
        public int fallbackWindowRows = 20;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FaultConfig {
        /** Marca que identifica filas de fallas D240 (en tipo o contenido). */
        public String marker = "故障代码D240";
    }
}
