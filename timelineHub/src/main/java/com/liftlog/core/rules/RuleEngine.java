package com.liftlog.core.rules;

import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import com.liftlog.core.render.DebugReport;
import com.liftlog.core.spi.RowStage;
import com.liftlog.core.time.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Anota cada fila con etiquetas y atributos globales sin tocar su contenido. Conserva la
 * cantidad de filas; las filas sin contenido pasan sin anotar.
 */
public class RuleEngine implements RowStage {
    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final RuleConfig cfg;
    private final CommentPayloadExtractor payloads = new CommentPayloadExtractor();
    private final AttributeExtractor attributes;
    private final RowTagger tagger;

    public RuleEngine(RuleConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.attributes = new AttributeExtractor(cfg);
        this.tagger = new RowTagger(cfg);
    }

    /** Filas anotadas más el registro de auditoría de la misma pasada. */
    public record Annotated(List<Row> rows, DebugReport debug) {}

    @Override public String name() { return "rules"; }

    @Override public boolean supports(SheetHeaders headers) {
        return headers.contentColumn().isPresent();
    }

    @Override
    public List<Row> apply(List<Row> rows, SheetHeaders headers) {
        return annotate(rows, headers).rows();
    }

    public Annotated annotate(List<Row> rows, SheetHeaders headers) {
        Optional<String> contentCol = headers.contentColumn();
        if (contentCol.isEmpty()) {
            log.debug("no content column in {}, rows left unannotated", headers.names());
            return new Annotated(rows, DebugReport.EMPTY);
        }
        String timeCol = headers.timeColumn().orElse(null);

        List<Row> out = new ArrayList<>(rows.size());
        List<DebugReport.IgnoredRow> ignored = new ArrayList<>();
        List<DebugReport.DelayedRow> delayed = new ArrayList<>();
        List<DebugReport.AttributeRow> withAttrs = new ArrayList<>();

        for (Row row : rows) {
            String content = row.text(contentCol.get());
            if (content.isEmpty()) {
                out.add(row);
                continue;
            }
            String time = Timestamps.display(row.value(timeCol));

            List<String> tags = tagger.tags(row, content, headers);
            Map<String, Object> attrs = attributes.extract(row, payloads.extract(row), headers);

            if (tags.contains(cfg.labels.nonCritical)) {
                ignored.add(new DebugReport.IgnoredRow(row.id(), time, content, cfg.nonCritical.reason));
            }
            OptionalLong delay = tagger.delayMinutes(row, headers);
            if (delay.isPresent()) {
                delayed.add(new DebugReport.DelayedRow(row.id(), time, content, delay.getAsLong()));
            }
            if (!attrs.isEmpty()) {
                List<String> pairs = new ArrayList<>(attrs.size());
                attrs.forEach((k, v) -> pairs.add(k + "=" + v));
                withAttrs.add(new DebugReport.AttributeRow(row.id(), time, content, pairs));
            }

            out.add(row.toBuilder().tags(tags).globalAttributes(attrs).build());
        }

        log.debug("annotated {} rows: {} ignored, {} delayed, {} with attributes",
                out.size(), ignored.size(), delayed.size(), withAttrs.size());
        return new Annotated(out, new DebugReport(ignored, delayed, withAttrs));
    }
}
