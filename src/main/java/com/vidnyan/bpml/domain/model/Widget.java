package com.vidnyan.bpml.domain.model;

/**
 * Dashboard widget. {@link #process()} is the process the widget reports on, or null when it is not bound to one.
 */
public interface Widget {

    String name();

    WidgetKind kind();

    String process();
}
