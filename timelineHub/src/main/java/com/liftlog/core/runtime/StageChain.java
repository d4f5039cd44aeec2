// core/runtime/StageChain.java
package com.liftlog.core.runtime;

import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import com.liftlog.core.spi.RowStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class StageChain {
  private static final Logger log = LoggerFactory.getLogger(StageChain.class);

  private final List<RowStage> stages;
  public StageChain(List<RowStage> stages){ this.stages = List.copyOf(stages); }

  public List<Row> apply(List<Row> rows, SheetHeaders headers){
    List<Row> cur = rows;
    for (var s : stages) {
      if (!s.supports(headers)) {
        log.debug("stage {} skipped: headers {} not supported", s.name(), headers.names());
        continue;
      }
      int before = cur.size();
      cur = s.apply(cur, headers);
      log.debug("stage {}: {} -> {} rows", s.name(), before, cur.size());
    }
    return cur;
  }
}
