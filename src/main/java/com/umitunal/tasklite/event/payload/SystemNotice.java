package com.umitunal.tasklite.event.payload;

/**
 * Infrastructure problem reported by a component, e.g. a failed persist in a
 * background loop.
 */
public final class SystemNotice implements EventPayload {
    private final String component;
    private final String message;
    private final Throwable cause;

    public SystemNotice(String component, String message, Throwable cause) {
        this.component = component;
        this.message = message;
        this.cause = cause;
    }

    public String getComponent() { return component; }
    public String getMessage() { return message; }

    /**
     * @return the underlying failure, or null for plain warnings
     */
    public Throwable getCause() { return cause; }

    @Override
    public String toString() {
        return String.format("SystemNotice{component='%s', message='%s'}", component, message);
    }
}
