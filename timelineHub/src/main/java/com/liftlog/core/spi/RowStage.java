// core/spi/RowStage.java
package com.liftlog.core.spi;

import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;

import java.util.List;

public interface RowStage {
  /** Nombre corto, para logs. */
  String name();
  /** ¿La etapa aplica a esta hoja? (p.ej. requiere columna de contenido) */
  boolean supports(SheetHeaders headers);
  /** Devuelve una lista nueva; nunca modifica la de entrada ni sus filas. */
  List<Row> apply(List<Row> rows, SheetHeaders headers);
}
