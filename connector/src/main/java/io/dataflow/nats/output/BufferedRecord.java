package io.dataflow.nats.output;

import io.nats.client.impl.Headers;

/** A record pushed into the open batch and waiting for {@code batchEnd}. */
final class BufferedRecord {

  final OutputPosition position;

  /** Encoded record body. */
  final byte[] payload;

  /** Complete header set, reserved position headers included. */
  final Headers headers;

  BufferedRecord(OutputPosition position, byte[] payload, Headers headers) {
    this.position = position;
    this.payload = payload;
    this.headers = headers;
  }
}
