package org.refactor.flowgraph.encode;

import java.util.ArrayList;
import java.util.List;

/**
 * 把源码片段切成粗粒度 token：空白和标点都是分隔符，标点本身不输出
 */
final class CodeTokenizer {

    private static final String DELIMITERS = "(){}[];,.<>=+-*/%&|!?:";

    private CodeTokenizer() {
    }

    static List<String> tokenize(String code) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (Character.isWhitespace(c) || DELIMITERS.indexOf(c) >= 0) {
                flush(current, tokens);
            } else {
                current.append(c);
            }
        }
        flush(current, tokens);
        return tokens;
    }

    private static void flush(StringBuilder current, List<String> tokens) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }
}
