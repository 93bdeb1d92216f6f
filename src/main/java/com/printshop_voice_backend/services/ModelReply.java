package com.printshop_voice_backend.services;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A language model reply, classified as spoken text, a tool invocation, or an
 * attempted tool invocation that could not be read.
 */
public abstract class ModelReply {

    private final String rawText;

    protected ModelReply(String rawText) {
        this.rawText = rawText;
    }

    public String getRawText() {
        return rawText;
    }

    public static final class PlainText extends ModelReply {
        public PlainText(String rawText) {
            super(rawText);
        }
    }

    public static final class ToolCall extends ModelReply {
        private final String toolName;
        private final ObjectNode params;
        private final boolean paramsDefaulted;

        public ToolCall(String rawText, String toolName, ObjectNode params, boolean paramsDefaulted) {
            super(rawText);
            this.toolName = toolName;
            this.params = params;
            this.paramsDefaulted = paramsDefaulted;
        }

        public String getToolName() {
            return toolName;
        }

        public ObjectNode getParams() {
            return params;
        }

        /**
         * True when the reply had no usable {@code params} object and an empty one was substituted.
         */
        public boolean isParamsDefaulted() {
            return paramsDefaulted;
        }
    }

    public static final class MalformedToolCall extends ModelReply {
        public MalformedToolCall(String rawText) {
            super(rawText);
        }
    }
}
