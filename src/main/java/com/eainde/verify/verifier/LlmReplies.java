package com.eainde.verify.verifier;

/**
 * Helpers for model replies that are supposed to be bare JSON.
 */
public final class LlmReplies {

    private LlmReplies() {
    }

    /**
     * Removes a surrounding markdown code fence ({@code ```json ... ```}) if the model added one.
     */
    public static String stripFences(String reply) {
        if (reply == null) {
            return "";
        }
        String text = reply.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline == -1 ? "" : text.substring(firstNewline + 1);
            int lastFence = text.lastIndexOf("```");
            if (lastFence != -1) {
                text = text.substring(0, lastFence);
            }
        }
        return text.strip();
    }
}
