package org.pragmatica.twistor.error;

import org.pragmatica.twistor.tree.SourceLocation;
import org.pragmatica.twistor.tree.SourceSpan;

/**
 * Failure to turn expression text into a tree. Terminal for the call that raised it: no partial tree is produced.
 */
public abstract sealed class TwistorSyntaxException extends Exception permits LexException, ParseException {
    private final SourceSpan span;
    private final String reason;

    protected TwistorSyntaxException(SourceSpan span, String reason, Throwable cause) {
        super(reason + " at " + span.start(), cause);
        this.span = span;
        this.reason = reason;
    }

    /**
     * Region of the input the failure refers to.
     */
    public SourceSpan span() {
        return span;
    }

    public SourceLocation location() {
        return span.start();
    }

    /**
     * Message without the location suffix.
     */
    public String reason() {
        return reason;
    }

    /**
     * Short category name, used as the diagnostic code.
     */
    public abstract String kind();
}
