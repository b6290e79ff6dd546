package com.conduit.provider.openai;

import com.conduit.model.FunctionCall;
import com.conduit.model.ToolCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reassembles streamed tool-call deltas by their {@code index}. The id, type and name
 * arrive once per call; later deltas append argument text.
 * One instance per stream; not thread-safe.
 */
class ToolCallAccumulator {

    private final Map<Integer, PartialCall> calls = new TreeMap<>();

    /**
     * Merge one delta and return the outgoing delta. The id, type and name are forwarded
     * only on the delta where they first appear for an index; later deltas carry the
     * index and the argument fragment.
     */
    ToolCall merge(ToolCall delta) {
        int index = delta.getIndex() != null ? delta.getIndex() : calls.size();
        PartialCall call = calls.computeIfAbsent(index, PartialCall::new);
        boolean newId = call.id == null && delta.getId() != null;
        FunctionCall function = delta.getFunction();
        boolean newName = call.name == null && function != null && function.getName() != null;
        call.absorb(delta);

        String fragment = function != null ? function.getArguments() : null;
        return ToolCall.builder()
                .index(index)
                .id(newId ? call.id : null)
                .type(newId ? call.type : null)
                .function(newName || fragment != null ? new FunctionCall(newName ? call.name : null, fragment) : null)
                .build();
    }

    List<ToolCall> merge(List<ToolCall> deltas) {
        List<ToolCall> merged = new ArrayList<>(deltas.size());
        for (ToolCall delta : deltas) {
            merged.add(merge(delta));
        }
        return merged;
    }

    /**
     * Calls assembled so far, in index order, with their full argument text.
     */
    List<ToolCall> assembled() {
        List<ToolCall> result = new ArrayList<>(calls.size());
        calls.values().forEach(call -> result.add(ToolCall.builder()
                .index(call.index)
                .id(call.id)
                .type(call.type)
                .function(new FunctionCall(call.name, call.arguments.toString()))
                .build()));
        return result;
    }

    private static final class PartialCall {
        private final int index;
        private String id;
        private String type = ToolCall.TYPE_FUNCTION;
        private String name;
        private final StringBuilder arguments = new StringBuilder();

        private PartialCall(int index) {
            this.index = index;
        }

        private void absorb(ToolCall delta) {
            if (delta.getId() != null) {
                id = delta.getId();
            }
            if (delta.getType() != null) {
                type = delta.getType();
            }
            FunctionCall function = delta.getFunction();
            if (function != null) {
                if (function.getName() != null) {
                    name = function.getName();
                }
                if (function.getArguments() != null) {
                    arguments.append(function.getArguments());
                }
            }
        }
    }
}
