package com.vidnyan.ust.adapter.out.parser.python;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;

/**
 * UTF-8 view of the parsed source; tree-sitter reports byte offsets.
 */
final class SourceText {

    private final byte[] bytes;

    SourceText(String source) {
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
    }

    String of(TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        int start = Math.max(0, node.getStartByte());
        int end = Math.min(bytes.length, node.getEndByte());
        return end > start ? new String(bytes, start, end - start, StandardCharsets.UTF_8) : "";
    }
}
