package io.dataflow.nats.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records of the open batch, in push order.
 *
 * <p>Not thread-safe; owned by a single endpoint.
 */
final class RecordBuffer {

  private final List<BufferedRecord> records = new ArrayList<>();
  private long totalBytes;

  void append(BufferedRecord record) {
    records.add(record);
    totalBytes += record.payload.length;
  }

  List<BufferedRecord> records() {
    return Collections.unmodifiableList(records);
  }

  int size() {
    return records.size();
  }

  /** Returns the summed payload size of the buffered records. */
  long totalBytes() {
    return totalBytes;
  }

  void clear() {
    records.clear();
    totalBytes = 0;
  }
}
