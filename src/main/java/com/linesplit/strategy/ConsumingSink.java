package com.linesplit.strategy;

/**
 * Sink that publishes every field reference to a volatile slot, so the JIT cannot prove the fields
 * unused and drop their derivation from the measured loop.
 * <p>
 * Only references are stored; no characters are copied, so a view-based strategy stays
 * allocation free. The stored references are never read back as text.
 */
public final class ConsumingSink implements FieldSink {

    private volatile CharSequence method;
    private volatile CharSequence resource;
    private volatile CharSequence httpVersion;

    @Override
    public void accept(CharSequence method, CharSequence resource, CharSequence httpVersion) {
        this.method = method;
        this.resource = resource;
        this.httpVersion = httpVersion;
    }

    /**
     * Whether any fields have been consumed yet.
     */
    public boolean hasConsumed() {
        return method != null && resource != null && httpVersion != null;
    }
}
