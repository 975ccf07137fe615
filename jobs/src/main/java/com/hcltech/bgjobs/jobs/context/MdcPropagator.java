package com.hcltech.bgjobs.jobs.context;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

final class MdcPropagator implements ContextPropagator<Map<String, String>> {
    static final MdcPropagator INSTANCE = new MdcPropagator();

    private MdcPropagator() {
    }

    @Override
    public Map<String, String> capture() {
        Map<String, String> current = MDC.getCopyOfContextMap();
        return current == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(current));
    }

    @Override
    public Restored restore(Map<String, String> snapshot) {
        final Map<String, String> previous = MDC.getCopyOfContextMap();
        apply(snapshot);
        return () -> apply(previous);
    }

    private static void apply(Map<String, String> map) {
        if (map == null || map.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(map);
        }
    }

    @Override
    public String toString() {
        return "MdcPropagator";
    }
}
