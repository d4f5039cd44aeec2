package com.liftlog.core.rules;

import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import com.liftlog.core.time.Timestamps;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Retraso de subida: hora propia de la fila menos la marca {@code yyyy-MM-dd HH:mm:ss}
 * embebida en el contenido. Ambas deben ser fecha y hora completas.
 */
public final class UploadDelay {
    private UploadDelay() {}

    public static Optional<Duration> of(Row row, SheetHeaders headers) {
        Optional<String> timeCol = headers.timeColumn();
        Optional<String> contentCol = headers.contentColumn();
        if (timeCol.isEmpty() || contentCol.isEmpty()) return Optional.empty();

        Optional<LocalDateTime> rowTime = Timestamps.parseDateTime(row.value(timeCol.get()));
        if (rowTime.isEmpty()) return Optional.empty();
        return Timestamps.findEmbedded(row.text(contentCol.get()))
                .map(contentTime -> Duration.between(contentTime, rowTime.get()));
    }
}
