package com.toolguard.regex;

/**
 * CharSequence view that aborts the regex engine once a deadline passes.
 * java.util.regex reads its input only through {@link #charAt}, so checking the
 * clock there bounds backtracking regardless of the pattern's shape.
 */
final class DeadlineCharSequence implements CharSequence {

    private static final int CHECK_INTERVAL = 1024;

    private final CharSequence delegate;
    private final long deadlineNanos;
    private int reads;

    DeadlineCharSequence(CharSequence delegate, long deadlineNanos) {
        this.delegate = delegate;
        this.deadlineNanos = deadlineNanos;
    }

    @Override
    public char charAt(int index) {
        if (++reads >= CHECK_INTERVAL) {
            reads = 0;
            if (System.nanoTime() - deadlineNanos > 0) {
                throw new MatchTimeoutException();
            }
        }
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return new DeadlineCharSequence(delegate.subSequence(start, end), deadlineNanos);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    static final class MatchTimeoutException extends RuntimeException {
        MatchTimeoutException() {
            super("regex match deadline exceeded", null, false, false);
        }
    }
}
