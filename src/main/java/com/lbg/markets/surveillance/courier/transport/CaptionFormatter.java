package com.lbg.markets.surveillance.courier.transport;

/**
 * Builds captions and texts in the endpoint's MarkdownV2 dialect.
 * Anything derived from a filename goes through {@link #escape(String)}.
 */
public final class CaptionFormatter {

    // Endpoint limit for document captions
    static final int MAX_CAPTION_LENGTH = 1024;

    private static final String SPECIAL = "_*[]()~`>#+-=|{}.!\\";

    private CaptionFormatter() {
    }

    public static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (SPECIAL.indexOf(c) >= 0) {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    /**
     * Caption for a delivered document; {@code total > 1} adds the part marker.
     */
    public static String documentCaption(String fileName, boolean encrypted, int part, int total) {
        String suffix = "\n" + (encrypted ? "🔒 Encrypted" : "🔓 Not encrypted");
        if (total > 1) {
            suffix += "\n\\(Part " + part + "/" + total + "\\)";
        }
        String name = fileName;
        String caption = "File: " + escape(name) + suffix;
        while (caption.length() > MAX_CAPTION_LENGTH && name.length() > 1) {
            // shorten the raw name so an escape sequence is never cut in half
            name = name.substring(0, name.length() / 2);
            caption = "File: " + escape(name + "…") + suffix;
        }
        return caption;
    }

    public static String errorNotice(String label) {
        return "Error sending file: " + escape(label) + "\\. Check logs\\.";
    }

    /**
     * Pre-formatted block; inside it only backslash and backtick need escaping.
     */
    public static String codeBlock(String text) {
        return "```\n" + text.replace("\\", "\\\\").replace("`", "\\`") + "\n```";
    }
}
