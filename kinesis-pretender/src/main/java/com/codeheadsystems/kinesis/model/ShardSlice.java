package com.codeheadsystems.kinesis.model;

import java.util.List;
import org.immutables.value.Value;

/**
 * The records read from a shard in one pass, and how many are left behind them.
 */
@Value.Immutable
public interface ShardSlice {

  /**
   * Records in ascending sequence order.
   *
   * @return the records
   */
  List<ShardRecord> records();

  /**
   * Number of records in the shard after the last one returned.
   *
   * @return the remaining count
   */
  int remaining();

}
