package com.liftlog.core.runtime;

import com.liftlog.config.PipelineConfig;
import com.liftlog.core.model.Row;
import com.liftlog.core.model.TimelineSheet;
import com.liftlog.core.partition.DevicePartitioner;
import com.liftlog.core.render.TimelineTextRenderer;
import com.liftlog.core.rules.RuleEngine;
import com.liftlog.plugins.fault.D240FaultMerger;
import com.liftlog.plugins.trace.TraceClusterAggregator;
import com.liftlog.plugins.xlsx.TimelineWorkbookReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.List;

/**
 * Punto de entrada: trazas → fallas D240 → reglas → texto. Sin estado entre ejecuciones;
 * una instancia puede usarse desde varios hilos mientras no se modifique su configuración.
 */
public class TimelinePipeline {
    private static final Logger log = LoggerFactory.getLogger(TimelinePipeline.class);

    private final StageChain chain;
    private final RuleEngine ruleEngine;
    private final TimelineTextRenderer renderer;
    private final TimelineWorkbookReader reader = new TimelineWorkbookReader();

    public TimelinePipeline() {
        this(PipelineConfig.defaults());
    }

    public TimelinePipeline(PipelineConfig cfg) {
        DevicePartitioner partitioner = new DevicePartitioner();
        this.chain = new StageChain(List.of(
                new TraceClusterAggregator(cfg.trace, partitioner),
                new D240FaultMerger(cfg.fault, partitioner)));
        this.ruleEngine = new RuleEngine(cfg.rules);
        this.renderer = new TimelineTextRenderer(cfg.rules.labels);
    }

    public PipelineResult run(TimelineSheet sheet) {
        List<Row> condensed = chain.apply(sheet.rows(), sheet.headers());
        RuleEngine.Annotated annotated = ruleEngine.annotate(condensed, sheet.headers());
        String text = renderer.render(annotated.rows(), sheet.headers());
        log.debug("sheet '{}': {} rows in, {} rows out", sheet.sheetName(), sheet.rows().size(), annotated.rows().size());
        return new PipelineResult(sheet.sheetName(), sheet.headers(), annotated.rows(), text, annotated.debug());
    }

    /** Lee un .xlsx y lo procesa. */
    public PipelineResult analyze(InputStream xlsx) {
        return run(reader.read(xlsx));
    }
}
