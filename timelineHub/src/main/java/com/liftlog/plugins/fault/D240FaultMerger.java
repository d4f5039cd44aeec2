package com.liftlog.plugins.fault;

import com.liftlog.config.PipelineConfig;
import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import com.liftlog.core.partition.DevicePartitioner;
import com.liftlog.core.spi.RowStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fusiona filas de fallas D240 que reportan partes de la misma ráfaga.
 *
 * <p>Por equipo y por valor de hora del equipo: las filas marcadas se agrupan por la marca
 * interna {@code [yyyy-MM-dd HH:mm:ss Nms]}; cada grupo queda en una sola fila con sus
 * entradas {@code ['...']} ordenadas por código. Los grupos, ordenados por marca interna,
 * ocupan los lugares de las filas D240 originales (el más temprano en el primer lugar) y los
 * lugares sobrantes se eliminan.
 */
public class D240FaultMerger implements RowStage {
    private static final Logger log = LoggerFactory.getLogger(D240FaultMerger.class);

    private static final Pattern INNER_TIME = Pattern.compile("\\[(\\d{4}-\\d{2}-\\d{2}\\s+\\d{2}:\\d{2}:\\d{2})\\s+(\\d+)ms\\]");
    private static final Pattern FAULT_ENTRY = Pattern.compile("(\\['[^']+'\\])");
    private static final Pattern FAULT_CODE = Pattern.compile("^\\s*'([A-Za-z0-9]+)");

    static final String NO_INNER_TIME = "0000-00-00 00:00:00";
    private static final String UNKNOWN_TIME = "UNKNOWN";

    private final PipelineConfig.FaultConfig cfg;
    private final DevicePartitioner partitioner;

    public D240FaultMerger(PipelineConfig.FaultConfig cfg, DevicePartitioner partitioner) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.partitioner = Objects.requireNonNull(partitioner, "partitioner");
    }

    @Override public String name() { return "d240-faults"; }

    @Override public boolean supports(SheetHeaders headers) {
        return headers.contentColumn().isPresent() && headers.timeColumn().isPresent();
    }

    @Override
    public List<Row> apply(List<Row> rows, SheetHeaders headers) {
        if (rows.isEmpty() || !supports(headers)) return rows;
        String contentCol = headers.contentColumn().get();
        String timeCol = headers.timeColumn().get();
        String typeCol = headers.typeColumn().orElse(null);

        Set<Integer> removed = new HashSet<>();
        Map<Integer, String> replacements = new HashMap<>();

        for (List<Integer> device : partitioner.partition(rows, headers).values()) {
            Map<String, List<Integer>> buckets = new LinkedHashMap<>();
            for (int idx : device) {
                Object t = rows.get(idx).value(timeCol);
                String key = t == null ? UNKNOWN_TIME : String.valueOf(t);
                buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(idx);
            }

            for (List<Integer> bucket : buckets.values()) {
                List<Integer> slots = new ArrayList<>();
                for (int idx : bucket) {
                    Row r = rows.get(idx);
                    if (r.text(contentCol).contains(cfg.marker) || (typeCol != null && r.text(typeCol).contains(cfg.marker))) {
                        slots.add(idx);
                    }
                }
                if (slots.isEmpty()) continue;

                List<String> merged = mergeContents(slots.stream().map(i -> rows.get(i).text(contentCol)).toList());
                for (int i = 0; i < slots.size(); i++) {
                    if (i < merged.size()) replacements.put(slots.get(i), merged.get(i));
                    else removed.add(slots.get(i));
                }
            }
        }

        if (replacements.isEmpty()) return rows;
        log.debug("merged D240 faults into {} rows, removed {} rows", replacements.size(), removed.size());

        List<Row> out = new ArrayList<>(rows.size() - removed.size());
        for (int i = 0; i < rows.size(); i++) {
            if (removed.contains(i)) continue;
            String content = replacements.get(i);
            out.add(content == null ? rows.get(i) : rows.get(i).withCellValue(contentCol, content));
        }
        return out;
    }

    /**
     * Contenidos D240 de un mismo cubo → contenidos fusionados, uno por marca interna,
     * ordenados por (hora interna, ms).
     */
    static List<String> mergeContents(List<String> contents) {
        SortedMap<InnerStamp, List<FaultEntry>> groups = new TreeMap<>();
        for (String content : contents) {
            Matcher m = INNER_TIME.matcher(content);
            InnerStamp stamp;
            String faultPart;
            if (m.find()) {
                stamp = new InnerStamp(m.group(1), new BigInteger(m.group(2)));
                faultPart = content.substring(m.end()).trim();
            } else {
                // sin marca interna: se conserva todo el contenido
                stamp = new InnerStamp(NO_INNER_TIME, BigInteger.ZERO);
                faultPart = content;
            }
            groups.computeIfAbsent(stamp, k -> new ArrayList<>()).addAll(entries(faultPart));
        }

        List<String> out = new ArrayList<>(groups.size());
        for (var en : groups.entrySet()) {
            List<FaultEntry> faults = en.getValue();
            faults.sort(Comparator.comparing(FaultEntry::code));
            StringBuilder sb = new StringBuilder();
            sb.append('[').append(en.getKey().time()).append(' ').append(en.getKey().ms()).append("ms] ");
            for (FaultEntry f : faults) sb.append(f.text());
            out.add(sb.toString());
        }
        return out;
    }

    static List<FaultEntry> entries(String faultPart) {
        List<FaultEntry> list = new ArrayList<>();
        Matcher m = FAULT_ENTRY.matcher(faultPart);
        while (m.find()) {
            String entry = m.group(1);
            Matcher code = FAULT_CODE.matcher(entry.substring(1));
            list.add(new FaultEntry(entry, code.find() ? code.group(1) : entry));
        }
        if (list.isEmpty()) list.add(new FaultEntry(faultPart, "0"));
        return list;
    }

    /** Marca interna; los ms se comparan como número, sin límite de dígitos. */
    record InnerStamp(String time, BigInteger ms) implements Comparable<InnerStamp> {
        @Override public int compareTo(InnerStamp o) {
            int c = time.compareTo(o.time);
            return c != 0 ? c : ms.compareTo(o.ms);
        }
    }

    /** Una entrada {@code ['...']} y su clave de orden (código alfanumérico inicial). */
    record FaultEntry(String text, String code) {}
}
