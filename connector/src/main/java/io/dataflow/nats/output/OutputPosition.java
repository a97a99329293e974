package io.dataflow.nats.output;

/**
 * Position of a record in the output: the engine step it belongs to and its index within the step.
 *
 * <p>Both components are unsigned 64-bit values. Positions are ordered by step, then substep.
 */
public final class OutputPosition implements Comparable<OutputPosition> {

  private final long step;
  private final long substep;

  public OutputPosition(long step, long substep) {
    this.step = step;
    this.substep = substep;
  }

  /** Returns the position of the first record of a step. */
  public static OutputPosition first(long step) {
    return new OutputPosition(step, 0L);
  }

  public long step() {
    return step;
  }

  public long substep() {
    return substep;
  }

  /** Returns the position following this one within the same step. */
  public OutputPosition nextSubstep() {
    return new OutputPosition(step, substep + 1);
  }

  @Override
  public int compareTo(OutputPosition other) {
    int byStep = Long.compareUnsigned(step, other.step);
    return byStep != 0 ? byStep : Long.compareUnsigned(substep, other.substep);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof OutputPosition)) return false;
    OutputPosition other = (OutputPosition) o;
    return step == other.step && substep == other.substep;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(step) + Long.hashCode(substep);
  }

  @Override
  public String toString() {
    return "(" + Long.toUnsignedString(step) + ", " + Long.toUnsignedString(substep) + ")";
  }
}
