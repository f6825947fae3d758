package org.sunbreeze.http.dispatch;

import java.util.Map;

public record DispatchContext(String method, String path, Map<String, String> params, boolean debug,
                              String routeName) {

    public DispatchContext {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

}
