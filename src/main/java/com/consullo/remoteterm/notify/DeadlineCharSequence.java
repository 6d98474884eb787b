package com.consullo.remoteterm.notify;

/**
 * {@link CharSequence} view that aborts a regex search once a wall-clock deadline passes.
 *
 * <p>
 * {@link java.util.regex.Matcher} reads its input only through {@link #charAt(int)}, so checking the clock there
 * bounds catastrophic backtracking. The clock is sampled every {@value #CHECK_INTERVAL} reads.
 * </p>
 */
final class DeadlineCharSequence implements CharSequence {

  static final int CHECK_INTERVAL = 4096;

  /**
   * Thrown from {@link #charAt(int)} when the deadline has passed. Never escapes the matcher.
   */
  static final class DeadlineExceededException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    DeadlineExceededException() {
      super("scan deadline exceeded", null, false, false);
    }
  }

  private final CharSequence delegate;
  private final long deadlineNanos;
  private int reads;

  DeadlineCharSequence(CharSequence delegate, long deadlineNanos) {
    this.delegate = delegate;
    this.deadlineNanos = deadlineNanos;
  }

  @Override
  public int length() {
    return delegate.length();
  }

  @Override
  public char charAt(int index) {
    if (++reads >= CHECK_INTERVAL) {
      reads = 0;
      if (System.nanoTime() - deadlineNanos > 0) {
        throw new DeadlineExceededException();
      }
    }
    return delegate.charAt(index);
  }

  @Override
  public CharSequence subSequence(int start, int end) {
    return new DeadlineCharSequence(delegate.subSequence(start, end), deadlineNanos);
  }

  @Override
  public String toString() {
    return delegate.toString();
  }
}
