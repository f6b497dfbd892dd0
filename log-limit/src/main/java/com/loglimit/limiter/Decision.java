package com.loglimit.limiter;

/**
 * Outcome of a single call reaching a rate-limited call site: whether the caller's message is
 * written, and which of the two announcements (suppression starting, logging resuming) go with it.
 */
public final class Decision {

  /**
   * Decision kinds.
   */
  public enum Kind {
    /** Write the message. */
    EMIT,
    /** Write the message; this call used up the window's budget, announce suppression. */
    EMIT_AND_WARN_SUPPRESSION_START,
    /** Drop the message. */
    SUPPRESS,
    /** A new window starts after drops: report the drops, then write the message. */
    WARN_RESUME_THEN_EMIT,
    /** A new window starts with nothing dropped: write the message. */
    RESUME_THEN_EMIT
  }

  private static final long NO_SUPPRESSION_START = -1L;

  private static final Decision EMIT = new Decision(Kind.EMIT, 0, 0, NO_SUPPRESSION_START);
  private static final Decision SUPPRESS = new Decision(Kind.SUPPRESS, 0, 0, NO_SUPPRESSION_START);
  private static final Decision RESUME_THEN_EMIT = new Decision(Kind.RESUME_THEN_EMIT, 0, 0,
      NO_SUPPRESSION_START);

  private final Kind kind;
  private final long suppressedCount;
  private final long elapsedNanos;
  private final long remainingNanos;

  private Decision(Kind kind, long suppressedCount, long elapsedNanos, long remainingNanos) {
    this.kind = kind;
    this.suppressedCount = suppressedCount;
    this.elapsedNanos = elapsedNanos;
    this.remainingNanos = remainingNanos;
  }

  public static Decision emit() {
    return EMIT;
  }

  public static Decision suppress() {
    return SUPPRESS;
  }

  public static Decision emitAndWarnSuppressionStart(long remainingNanos) {
    return new Decision(Kind.EMIT_AND_WARN_SUPPRESSION_START, 0, 0, Math.max(0, remainingNanos));
  }

  public static Decision resumeThenEmit() {
    return RESUME_THEN_EMIT;
  }

  public static Decision warnResumeThenEmit(long suppressedCount, long elapsedNanos) {
    return new Decision(Kind.WARN_RESUME_THEN_EMIT, suppressedCount, elapsedNanos,
        NO_SUPPRESSION_START);
  }

  /**
   * Returns a copy of this window-starting decision that also announces the start of suppression.
   * Only needed when the threshold is so low that the call opening a window already exhausts it.
   *
   * @param remainingNanos time left in the window that was just opened.
   * @return decision of the same kind that also starts suppression.
   */
  Decision withSuppressionStart(long remainingNanos) {
    Kind newKind = kind == Kind.EMIT ? Kind.EMIT_AND_WARN_SUPPRESSION_START : kind;
    return new Decision(newKind, suppressedCount, elapsedNanos, Math.max(0, remainingNanos));
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * @return whether the caller's message is written.
   */
  public boolean isEmit() {
    return kind != Kind.SUPPRESS;
  }

  /**
   * @return whether the "logging again" summary is due before the message.
   */
  public boolean isResumeSummary() {
    return kind == Kind.WARN_RESUME_THEN_EMIT;
  }

  /**
   * @return whether the "starting to ignore" warning is due with this call.
   */
  public boolean isSuppressionStart() {
    return remainingNanos != NO_SUPPRESSION_START;
  }

  /**
   * @return messages dropped in the window that just ended (resume summary only).
   */
  public long getSuppressedCount() {
    return suppressedCount;
  }

  /**
   * @return age of the window that just ended (resume summary only).
   */
  public long getElapsedNanos() {
    return elapsedNanos;
  }

  /**
   * @return time left until the window ends (suppression start only), never negative.
   */
  public long getRemainingNanos() {
    return Math.max(0, remainingNanos);
  }

  @Override
  public String toString() {
    switch (kind) {
      case EMIT_AND_WARN_SUPPRESSION_START:
        return kind + "(remaining=" + remainingNanos + "ns)";
      case WARN_RESUME_THEN_EMIT:
        return kind + "(suppressed=" + suppressedCount + ", elapsed=" + elapsedNanos + "ns" +
            (isSuppressionStart() ? ", remaining=" + remainingNanos + "ns" : "") + ")";
      case RESUME_THEN_EMIT:
        return isSuppressionStart() ? kind + "(remaining=" + remainingNanos + "ns)" : kind.name();
      default:
        return kind.name();
    }
  }
}
