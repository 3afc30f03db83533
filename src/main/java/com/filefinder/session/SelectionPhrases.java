package com.filefinder.session;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 消歧会话识别的口语短语：取消、重复选项、按序号或序数词选择。
 */
final class SelectionPhrases {

    private static final List<String> CANCEL_PHRASES = List.of(
        "cancel", "never mind", "forget it", "leave it", "stop that", "don't open", "do not open"
    );

    private static final List<String> REPEAT_PHRASES = List.of(
        "repeat", "what were", "show again", "say again"
    );

    private static final List<String> OPTION_WORDS = List.of("option", "choices", "list");

    private static final Map<String, String> SPOKEN_NUMBERS = Map.of(
        "one", "1", "two", "2", "three", "3", "four", "4", "five", "5",
        "six", "6", "seven", "7", "eight", "8", "nine", "9", "ten", "10"
    );

    private static final List<Pattern> ORDINALS = List.of(
        Pattern.compile("\\bfirst\\b"),
        Pattern.compile("\\bsecond\\b"),
        Pattern.compile("\\bthird\\b"),
        Pattern.compile("\\bfourth\\b"),
        Pattern.compile("\\bfifth\\b")
    );

    private static final Pattern SPOKEN_NUMBER_PATTERN =
        Pattern.compile("\\b(one|two|three|four|five|six|seven|eight|nine|ten)\\b");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private SelectionPhrases() {
    }

    static String normalize(String utterance) {
        return utterance == null ? "" : utterance.trim().toLowerCase(Locale.ROOT);
    }

    static boolean isCancel(String text) {
        return CANCEL_PHRASES.stream().anyMatch(text::contains);
    }

    static boolean isRepeat(String text) {
        if (text.contains("show") && OPTION_WORDS.stream().anyMatch(text::contains)) {
            return true;
        }
        return REPEAT_PHRASES.stream().anyMatch(text::contains);
    }

    /**
     * 解析从 0 开始的选择序号：序数词优先（"the second one" 取第二项），否则找数字（口语数词先转成数字）。
     */
    static OptionalInt choiceIndex(String text) {
        for (int index = 0; index < ORDINALS.size(); index++) {
            if (ORDINALS.get(index).matcher(text).find()) {
                return OptionalInt.of(index);
            }
        }
        Matcher digitMatcher = DIGITS.matcher(replaceSpokenNumbers(text));
        if (digitMatcher.find()) {
            try {
                return OptionalInt.of(Integer.parseInt(digitMatcher.group()) - 1);
            } catch (NumberFormatException overflow) {
                return OptionalInt.of(Integer.MAX_VALUE);
            }
        }
        return OptionalInt.empty();
    }

    static String replaceSpokenNumbers(String text) {
        Matcher matcher = SPOKEN_NUMBER_PATTERN.matcher(text);
        StringBuilder replaced = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(replaced, SPOKEN_NUMBERS.get(matcher.group(1)));
        }
        matcher.appendTail(replaced);
        return replaced.toString();
    }
}
