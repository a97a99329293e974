package io.dataflow.nats.output;

/**
 * Lifecycle state of a {@link NatsFtOutputEndpoint}.
 *
 * <p>Transitions follow this pattern:
 *
 * <pre>
 * NEW → CONNECTED → BATCH_OPEN ⇄ BATCH_CLOSED
 *  ↑                    │
 *  └── failed flush ────┘
 * </pre>
 */
public enum EndpointState {
  /** Endpoint created, or its session was released. */
  NEW,

  /** Session established and resume step known; no batch opened yet. */
  CONNECTED,

  /** A batch is open and accepting records. */
  BATCH_OPEN,

  /** The last batch was fully published and acknowledged. */
  BATCH_CLOSED
}
