package com.filefinder.text;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 查询与文件名的统一归一化：去扩展名、分隔符转空格、压缩空白、小写。
 */
public final class QueryNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[_-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private QueryNormalizer() {
    }

    /**
     * 归一化文件名或查询文本，null 视为空串。
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String withoutExtension = stripExtension(text.trim());
        String separated = SEPARATORS.matcher(withoutExtension).replaceAll(" ");
        return WHITESPACE.matcher(separated.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * 对已归一化的文本按空白切词。
     */
    public static List<String> tokenize(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(normalizedText.trim()));
    }

    /**
     * 去掉末尾的 ".xyz"；以点开头的名称或后缀中含空白的不视为扩展名。
     */
    static String stripExtension(String text) {
        int lastDotIndex = text.lastIndexOf('.');
        if (lastDotIndex <= 0 || lastDotIndex == text.length() - 1) {
            return text;
        }
        for (int index = lastDotIndex + 1; index < text.length(); index++) {
            if (Character.isWhitespace(text.charAt(index))) {
                return text;
            }
        }
        return text.substring(0, lastDotIndex);
    }
}
