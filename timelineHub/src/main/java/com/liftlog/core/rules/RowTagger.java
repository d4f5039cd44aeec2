package com.liftlog.core.rules;

import com.liftlog.core.model.Cell;
import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Etiquetas efímeras de una fila. Las reglas son independientes: se agregan todas las que
 * aplican, en el orden no-crítico, retraso, operación humana, orden de trabajo.
 */
public class RowTagger {
    private static final Logger log = LoggerFactory.getLogger(RowTagger.class);

    private static final Pattern HEX_COLOR = Pattern.compile("#[0-9A-Fa-f]{6}");

    private final RuleConfig cfg;
    private final List<Pattern> nonCriticalRegexes = new ArrayList<>();

    public RowTagger(RuleConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        for (String re : cfg.nonCritical.regexes) {
            try {
                nonCriticalRegexes.add(Pattern.compile(re));
            } catch (PatternSyntaxException e) {
                log.warn("ignoring invalid non-critical regex '{}': {}", re, e.getDescription());
            }
        }
    }

    public List<String> tags(Row row, String content, SheetHeaders headers) {
        List<String> tags = new ArrayList<>();
        if (isNonCritical(content)) tags.add(cfg.labels.nonCritical);
        delayMinutes(row, headers).ifPresent(m -> tags.add(String.format(Locale.ROOT, cfg.labels.delayedUpload, m)));
        if (isHumanOperation(row, content)) tags.add(cfg.labels.humanOperation);
        if (isWorkOrder(content)) tags.add(cfg.labels.workOrder);
        return tags;
    }

    public boolean isNonCritical(String content) {
        for (String phrase : cfg.nonCritical.phrases) {
            if (content.contains(phrase)) return true;
        }
        for (Pattern p : nonCriticalRegexes) {
            if (p.matcher(content).find()) return true;
        }
        return false;
    }

    /** Minutos enteros de retraso, solo si superan estrictamente el umbral. */
    public OptionalLong delayMinutes(Row row, SheetHeaders headers) {
        Optional<Duration> delay = UploadDelay.of(row, headers);
        if (delay.isEmpty() || delay.get().getSeconds() <= cfg.delay.thresholdMinutes * 60L) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(delay.get().toMinutes());
    }

    public boolean isHumanOperation(Row row, String content) {
        for (Cell c : row.cells().values()) {
            if (isPurple(c.style().backgroundColor())) return true;
        }
        for (String phrase : cfg.humanOperation.phrases) {
            if (content.contains(phrase)) return true;
        }
        return false;
    }

    public boolean isWorkOrder(String content) {
        return cfg.workOrder.phrase != null && !cfg.workOrder.phrase.isEmpty() && content.contains(cfg.workOrder.phrase);
    }

    boolean isPurple(String hex) {
        if (hex == null || !HEX_COLOR.matcher(hex).matches()) return false;
        int r = Integer.parseInt(hex.substring(1, 3), 16);
        int g = Integer.parseInt(hex.substring(3, 5), 16);
        int b = Integer.parseInt(hex.substring(5, 7), 16);
        var h = cfg.humanOperation;
        return r > h.minRed && b > h.minBlue && g < h.maxGreen;
    }
}
