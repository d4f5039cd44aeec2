package com.liftlog.plugins.trace;

import com.liftlog.config.PipelineConfig;
import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import com.liftlog.core.partition.DevicePartitioner;
import com.liftlog.core.spi.RowStage;
import com.liftlog.core.time.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Colapsa cada ráfaga de trazas de diagnóstico (control 53552.., gestión 53504..) en una sola
 * fila resumen que indica si llegaron todos los ids esperados.
 *
 * <p>Por cada equipo: la fila cuyo id de traza es el centro de una familia busca compañeras
 * en una ventana alrededor suyo. Si su hora se puede parsear la ventana es de
 * ±{@code timeWindowRows} filas y [-secondsBefore, +secondsAfter] segundos; si no, de
 * ±{@code fallbackWindowRows} filas sin mirar la hora. El contenido del centro se reemplaza
 * por el resumen y las compañeras desaparecen.
 *
 * <p>Ventanas solapadas no se protegen: si dos centros reclaman la misma fila, la fila sale
 * igual y gana el último centro procesado.
 */
public class TraceClusterAggregator implements RowStage {
    private static final Logger log = LoggerFactory.getLogger(TraceClusterAggregator.class);

    private static final Pattern TRACE_ID = Pattern.compile("Trace[:：]\\s*(\\d+)");
    private static final Pattern BRACKETED = Pattern.compile("(\\[[^\\]]+\\])");

    private final PipelineConfig.TraceConfig cfg;
    private final DevicePartitioner partitioner;
    private final Map<String, TraceFamily> familiesByCenter = new HashMap<>();

    public TraceClusterAggregator(PipelineConfig.TraceConfig cfg, DevicePartitioner partitioner) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.partitioner = Objects.requireNonNull(partitioner, "partitioner");
        for (TraceFamily f : cfg.families) familiesByCenter.put(f.centerId(), f);
    }

    @Override public String name() { return "trace-clusters"; }

    @Override public boolean supports(SheetHeaders headers) {
        return headers.contentColumn().isPresent();
    }

    @Override
    public List<Row> apply(List<Row> rows, SheetHeaders headers) {
        Optional<String> contentCol = headers.contentColumn();
        if (rows.isEmpty() || contentCol.isEmpty()) return rows;
        String timeCol = headers.timeColumn().orElse(null);

        Set<Integer> removed = new HashSet<>();
        Map<Integer, String> replacements = new HashMap<>();

        for (List<Integer> group : partitioner.partition(rows, headers).values()) {
            List<String> ids = new ArrayList<>(group.size());
            List<LocalDateTime> times = new ArrayList<>(group.size());
            for (int idx : group) {
                Row r = rows.get(idx);
                ids.add(extractTraceId(r.text(contentCol.get())));
                times.add(Timestamps.parseLenient(r.value(timeCol)).orElse(null));
            }

            for (int pos = 0; pos < group.size(); pos++) {
                TraceFamily family = familiesByCenter.get(ids.get(pos));
                int centerIdx = group.get(pos);
                // una fila ya absorbida por otro cluster no vuelve a ser centro
                if (family == null || removed.contains(centerIdx)) continue;

                List<Integer> members = findMembers(family, pos, ids, times);
                SortedSet<String> missing = family.expectedIds();
                for (int p : members) missing.remove(ids.get(p));

                String content = rows.get(centerIdx).text(contentCol.get());
                replacements.put(centerIdx, summary(family, bracketedTimestamp(content), missing));
                for (int p : members) {
                    if (p != pos) removed.add(group.get(p));
                }
            }
        }

        if (replacements.isEmpty()) return rows;
        log.debug("collapsed {} trace clusters, removed {} companion rows", replacements.size(), removed.size());

        List<Row> out = new ArrayList<>(rows.size() - removed.size());
        for (int i = 0; i < rows.size(); i++) {
            if (removed.contains(i)) continue;
            String summary = replacements.get(i);
            out.add(summary == null ? rows.get(i) : rows.get(i).withCellValue(contentCol.get(), summary));
        }
        return out;
    }

    /** Posiciones dentro del grupo de las filas del cluster, centro incluido. */
    private List<Integer> findMembers(TraceFamily family, int centerPos,
                                      List<String> ids, List<LocalDateTime> times) {
        LocalDateTime centerTime = times.get(centerPos);
        int span = centerTime != null ? cfg.timeWindowRows : cfg.fallbackWindowRows;
        int from = Math.max(0, centerPos - span);
        int to = Math.min(ids.size() - 1, centerPos + span);

        List<Integer> members = new ArrayList<>();
        for (int p = from; p <= to; p++) {
            if (!family.isMember(ids.get(p))) continue;
            if (centerTime != null && !withinSeconds(centerTime, times.get(p))) continue;
            members.add(p);
        }
        return members;
    }

    private boolean withinSeconds(LocalDateTime center, LocalDateTime candidate) {
        if (candidate == null) return false;
        // sin truncar: +20.9s ya queda fuera
        Duration delta = Duration.between(center, candidate);
        return delta.compareTo(Duration.ofSeconds(-cfg.secondsBefore)) >= 0
                && delta.compareTo(Duration.ofSeconds(cfg.secondsAfter)) <= 0;
    }

    static String summary(TraceFamily family, String timestamp, SortedSet<String> missing) {
        String head = family.label() + "Trace" + timestamp;
        if (missing.isEmpty()) return head + "（完整）";
        return head + " 缺少" + String.join("、", missing) + "数据";
    }

    static String extractTraceId(String text) {
        if (text == null || text.isEmpty()) return null;
        Matcher m = TRACE_ID.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    static String bracketedTimestamp(String text) {
        if (text == null) return "";
        Matcher m = BRACKETED.matcher(text);
        return m.find() ? m.group(1) : "";
    }
}
