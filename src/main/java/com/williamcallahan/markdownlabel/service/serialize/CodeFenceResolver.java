package com.williamcallahan.markdownlabel.service.serialize;

/**
 * Chooses code fence and code span delimiters that cannot collide with the code they wrap.
 */
public final class CodeFenceResolver {

    public static final int MIN_FENCE_LENGTH = 3;

    private CodeFenceResolver() {}

    /**
     * Finds the longest run of one character.
     * @param content text to scan
     * @param marker character to count
     * @return length of the longest contiguous run, zero when absent
     */
    public static int longestRun(String content, char marker) {
        if (content == null) {
            return 0;
        }
        int longest = 0;
        int current = 0;
        for (int index = 0; index < content.length(); index++) {
            if (content.charAt(index) == marker) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }

    /**
     * Gets the backtick fence length for a code block: one longer than the longest
     * backtick run in the content, never shorter than three.
     *
     * @param content code block content
     * @return fence length
     */
    public static int fenceLength(String content) {
        return Math.max(MIN_FENCE_LENGTH, longestRun(content, '`') + 1);
    }

    /**
     * Builds the fence for a code block. Info strings containing a backtick cannot follow a
     * backtick fence, so those blocks are fenced with tildes.
     *
     * @param content code block content
     * @param info language identifier, may be empty
     * @return opening (and closing) fence
     */
    public static String fence(String content, String info) {
        if (info != null && info.indexOf('`') >= 0) {
            return "~".repeat(Math.max(MIN_FENCE_LENGTH, longestRun(content, '~') + 1));
        }
        return "`".repeat(fenceLength(content));
    }

    /**
     * Wraps inline code in a backtick string longer than any run inside it. Content that
     * starts or ends with a backtick, or is wrapped in spaces, gets one space of padding on
     * each side, which parsers strip again.
     *
     * @param content code span content
     * @return serialized code span
     */
    public static String codeSpan(String content) {
        String code = content == null ? "" : content;
        String delimiter = "`".repeat(longestRun(code, '`') + 1);
        boolean pad = code.startsWith("`") || code.endsWith("`")
            || (code.length() >= 2 && code.startsWith(" ") && code.endsWith(" ") && !code.isBlank());
        String body = pad ? " " + code + " " : code;
        return delimiter + body + delimiter;
    }
}
