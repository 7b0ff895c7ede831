package org.refactor.flowgraph;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * 结果的 JSON 输出
 */
public final class GraphJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private GraphJson() {
    }

    public static String toJson(Object value) {
        return GSON.toJson(value);
    }

    public static Gson gson() {
        return GSON;
    }
}
