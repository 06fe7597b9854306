package com.wirevizweb.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing WireViz-Web MDC keys for structured logging.
 */
public final class RenderMdc {

    public static final String RENDER_ID = "renderId";
    public static final String FORMAT = "format";

    private RenderMdc() {}

    public static void setRender(String renderId, String format) {
        MDC.put(RENDER_ID, renderId);
        MDC.put(FORMAT, format);
    }

    public static void clear() {
        MDC.remove(RENDER_ID);
        MDC.remove(FORMAT);
    }
}
