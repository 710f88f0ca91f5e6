package ai.palicorpus.translator.sanitize;

import ai.palicorpus.translator.corpus.Language;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalises raw provider output and decides whether it can be trusted.
 *
 * <p>Pure: content problems come back as {@link ValidationError} values.
 */
public class TextSanitizer {

    public static final char ZERO_WIDTH_JOINER = '\u200D';

    private static final List<Pattern> PREAMBLES = List.of(
            Pattern.compile("\\A\\s*(?:\\*\\*)?\\s*here is the (?:(?:english|sinhala) )?translation[^:\\n]*?(?:\\*\\*)?\\s*[:\\n]\\s*(?:\\*\\*)?\\s*",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile("\\A\\s*(?:\\*\\*)?\\s*(?:(?:english|sinhala) )?translation\\s*(?:\\*\\*)?\\s*:\\s*(?:\\*\\*)?\\s*",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
            Pattern.compile("\\A\\s*(?:\\*\\*)?\\s*සිංහල පරිවර්තනය\\s*(?:\\*\\*)?\\s*:?\\s*"));
    private static final Pattern PAGE_NOISE = Pattern.compile("\\bpage\\s+\\d+\\s+(?:of|sur)\\s+\\d+\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern UNICODE_ESCAPE = Pattern.compile("\\\\u([0-9a-fA-F]{4})");
    private static final Pattern JOINER_PLACEHOLDER = Pattern.compile(
            "<zwj>|\\[zwj]|#zwj;|#zwj#|_zwj_|&zwj;|&#8205;|&#x200d;", Pattern.CASE_INSENSITIVE);
    private static final Pattern STRAY_INVISIBLES = Pattern.compile("[\\u200B\\u200C\\uFEFF\\u2060]");
    private static final Pattern LEADING_ORDINAL = Pattern.compile(
            "\\A\\s*(?:\\(\\s*(?:\\d+|[ivx]{1,4})\\s*\\)|(?:\\d+|[ivx]{1,4})\\s*[.)])\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXCESS_BREAKS = Pattern.compile("(?:[ \\t]*\\r?\\n){3,}");
    private static final Pattern LEFTOVER_ARTIFACT = Pattern.compile(
            "\\\\u[0-9a-fA-F]{4}|[<\\[#_&](?:zwj|zwnj|zwsp|nbsp|bom)[>\\];#_]|&#x?[0-9a-f]+;",
            Pattern.CASE_INSENSITIVE);

    private final SanitizerSettings settings;

    public TextSanitizer() {
        this(SanitizerSettings.defaults());
    }

    public TextSanitizer(SanitizerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public SanitizationResult sanitize(String raw, String sourceText, Language target) {
        Objects.requireNonNull(target, "target");
        if (raw == null || raw.isBlank()) {
            return SanitizationResult.rejected(ValidationErrorKind.EMPTY_TRANSLATION, "Provider returned no text");
        }
        String text = normalize(raw, sourceText == null ? "" : sourceText, target);
        if (text.isEmpty()) {
            return SanitizationResult.rejected(ValidationErrorKind.EMPTY_TRANSLATION,
                    "Nothing left after removing provider noise");
        }
        if (text.indexOf('\uFFFD') >= 0) {
            return SanitizationResult.rejected(ValidationErrorKind.ARTIFACT_ENCODING, "Contains U+FFFD replacement characters");
        }
        Matcher artifact = LEFTOVER_ARTIFACT.matcher(text);
        if (artifact.find()) {
            return SanitizationResult.rejected(ValidationErrorKind.ARTIFACT_ENCODING,
                    "Contains encoding artifact '" + artifact.group() + "'");
        }
        int sourceLength = sourceText == null ? 0 : sourceText.strip().codePointCount(0, sourceText.strip().length());
        int length = text.codePointCount(0, text.length());
        double limit = Math.max(settings.maxLengthRatio() * sourceLength, settings.minimumLengthAllowance());
        if (length > limit) {
            return SanitizationResult.rejected(ValidationErrorKind.OVER_EXPANSION,
                    "Translation has %d characters for a %d character source (limit %.0f)"
                            .formatted(length, sourceLength, limit));
        }
        return checkScript(text, target);
    }

    String normalize(String raw, String sourceText, Language target) {
        String text = raw;
        for (Pattern preamble : PREAMBLES) {
            text = preamble.matcher(text).replaceFirst("");
        }
        text = PAGE_NOISE.matcher(text).replaceAll("");
        text = decodeEscapes(text);
        text = JOINER_PLACEHOLDER.matcher(text).replaceAll(String.valueOf(ZERO_WIDTH_JOINER));
        text = STRAY_INVISIBLES.matcher(text).replaceAll("");
        if (!target.usesJoiner()) {
            text = text.replace(String.valueOf(ZERO_WIDTH_JOINER), "");
        }
        if (!LEADING_ORDINAL.matcher(sourceText).find()) {
            text = LEADING_ORDINAL.matcher(text).replaceFirst("");
        }
        text = EXCESS_BREAKS.matcher(text).replaceAll("\n\n");
        return text.strip();
    }

    private static String decodeEscapes(String text) {
        Matcher matcher = UNICODE_ESCAPE.matcher(text);
        StringBuilder decoded = new StringBuilder(text.length());
        while (matcher.find()) {
            char value = (char) Integer.parseInt(matcher.group(1), 16);
            matcher.appendReplacement(decoded, Matcher.quoteReplacement(String.valueOf(value)));
        }
        matcher.appendTail(decoded);
        return decoded.toString();
    }

    private SanitizationResult checkScript(String text, Language target) {
        int letters = 0;
        int inScript = 0;
        for (int offset = 0; offset < text.length(); ) {
            int codePoint = text.codePointAt(offset);
            offset += Character.charCount(codePoint);
            if (!Character.isLetter(codePoint)) {
                continue;
            }
            Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
            if (script == Character.UnicodeScript.COMMON || script == Character.UnicodeScript.INHERITED) {
                continue;
            }
            if (target.forbiddenScripts().contains(script)) {
                return SanitizationResult.rejected(ValidationErrorKind.FOREIGN_CHARACTER,
                        "Contains %s characters in a %s translation".formatted(script, target.displayName()));
            }
            letters++;
            if (script == target.script()) {
                inScript++;
            }
        }
        if (letters > 0 && (double) inScript / letters < settings.minScriptRatio()) {
            return SanitizationResult.rejected(ValidationErrorKind.FOREIGN_CHARACTER,
                    "Only %d of %d letters are %s script".formatted(inScript, letters, target.script()));
        }
        return SanitizationResult.accepted(text);
    }
}
