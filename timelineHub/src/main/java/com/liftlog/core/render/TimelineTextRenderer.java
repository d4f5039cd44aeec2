package com.liftlog.core.render;

import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import com.liftlog.core.rules.RuleConfig;
import com.liftlog.core.time.Timestamps;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Texto compacto, una línea por fila, para el resumidor externo:
 * <pre>
 * [2025-12-08 10:20:00] [👷人为操作] 检修开始
 *     &gt;&gt; 全局属性: 同步楼层=3
 * </pre>
 * Las filas no críticas y las filas sin contenido no aparecen.
 */
public class TimelineTextRenderer {
    private final RuleConfig.LabelConfig labels;

    public TimelineTextRenderer(RuleConfig.LabelConfig labels) {
        this.labels = Objects.requireNonNull(labels, "labels");
    }

    public String render(List<Row> rows, SheetHeaders headers) {
        Optional<String> contentCol = headers.contentColumn();
        if (contentCol.isEmpty()) return "";
        String timeCol = headers.timeColumn().orElse(null);

        StringJoiner out = new StringJoiner("\n");
        for (Row row : rows) {
            String content = row.text(contentCol.get());
            if (content.isEmpty() || row.tags().contains(labels.nonCritical)) continue;

            StringBuilder line = new StringBuilder();
            line.append('[').append(Timestamps.display(row.value(timeCol))).append("] ");
            for (String tag : row.tags()) line.append(tag).append(' ');
            line.append(content);

            if (!row.globalAttributes().isEmpty()) {
                StringJoiner attrs = new StringJoiner(", ");
                row.globalAttributes().forEach((k, v) -> attrs.add(k + "=" + v));
                line.append('\n').append(labels.attributesIndent).append(labels.attributesLine).append(attrs);
            }
            out.add(line);
        }
        return out.toString();
    }
}
