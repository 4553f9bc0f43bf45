package pl.marcinmilkowski.vocab_store.attrs;

import pl.marcinmilkowski.vocab_store.lexicon.AttrKey;
import pl.marcinmilkowski.vocab_store.lexicon.Flags;
import pl.marcinmilkowski.vocab_store.lexicon.LexAttr;
import pl.marcinmilkowski.vocab_store.lexicon.Vocab;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Standard language-independent lexical attributes.
 *
 * {@link #install} registers the string slots (lower, norm, shape, prefix,
 * suffix), cluster, prob and the built-in flags on bits 1..17.
 */
public final class DefaultLexAttrs {

    private static final Set<String> BRACKETS = new HashSet<>(Arrays.asList(
        "(", ")", "[", "]", "{", "}", "<", ">"
    ));

    private static final Set<String> QUOTES = new HashSet<>(Arrays.asList(
        "'", "\"", "`", "''", "``", "‘", "’", "“", "”", "«", "»", "„", "‚"
    ));

    private static final Set<String> LEFT_PUNCT = new HashSet<>(Arrays.asList(
        "(", "[", "{", "<", "``", "‘", "“", "«", "„", "‚"
    ));

    private static final Set<String> RIGHT_PUNCT = new HashSet<>(Arrays.asList(
        ")", "]", "}", ">", "''", "’", "”", "»"
    ));

    private static final Set<String> NUMBER_WORDS = new HashSet<>(Arrays.asList(
        "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten",
        "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen", "seventeen", "eighteen",
        "nineteen", "twenty", "thirty", "forty", "fifty", "sixty", "seventy", "eighty", "ninety",
        "hundred", "thousand", "million", "billion", "trillion"
    ));

    private static final Set<String> URL_SUFFIXES = new HashSet<>(Arrays.asList(
        "com", "org", "net", "edu", "gov", "mil", "int", "info", "biz", "io", "co",
        "uk", "de", "pl", "fr", "it", "es", "nl", "eu", "ru", "jp", "cn", "us", "ca", "au"
    ));

    private static final Pattern EMAIL = Pattern.compile(
        "^[A-Za-z0-9!#$%&'*+/=?^_`{|}~.-]+@[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}$"
    );

    private DefaultLexAttrs() {
    }

    public static void install(Vocab vocab) {
        install(vocab, Set.of());
    }

    /**
     * @param stopWords lowercase stop words for IS_STOP
     */
    public static void install(Vocab vocab, Set<String> stopWords) {
        float oovProb = vocab.config().oovProb();

        vocab.registerGetter(AttrKey.of(LexAttr.LOWER), DefaultLexAttrs::lower);
        vocab.registerGetter(AttrKey.of(LexAttr.NORM), DefaultLexAttrs::lower);
        vocab.registerGetter(AttrKey.of(LexAttr.SHAPE), WordShape::of);
        vocab.registerGetter(AttrKey.of(LexAttr.PREFIX), DefaultLexAttrs::prefix);
        vocab.registerGetter(AttrKey.of(LexAttr.SUFFIX), DefaultLexAttrs::suffix);
        vocab.registerGetter(AttrKey.of(LexAttr.CLUSTER), s -> 0);
        vocab.registerGetter(AttrKey.of(LexAttr.PROB), s -> oovProb);

        vocab.registerGetter(AttrKey.flag(Flags.IS_ALPHA), DefaultLexAttrs::isAlpha);
        vocab.registerGetter(AttrKey.flag(Flags.IS_ASCII), DefaultLexAttrs::isAscii);
        vocab.registerGetter(AttrKey.flag(Flags.IS_DIGIT), DefaultLexAttrs::isDigit);
        vocab.registerGetter(AttrKey.flag(Flags.IS_LOWER), DefaultLexAttrs::isLower);
        vocab.registerGetter(AttrKey.flag(Flags.IS_PUNCT), DefaultLexAttrs::isPunct);
        vocab.registerGetter(AttrKey.flag(Flags.IS_SPACE), DefaultLexAttrs::isSpace);
        vocab.registerGetter(AttrKey.flag(Flags.IS_TITLE), DefaultLexAttrs::isTitle);
        vocab.registerGetter(AttrKey.flag(Flags.IS_UPPER), DefaultLexAttrs::isUpper);
        vocab.registerGetter(AttrKey.flag(Flags.LIKE_URL), DefaultLexAttrs::likeUrl);
        vocab.registerGetter(AttrKey.flag(Flags.LIKE_NUM), DefaultLexAttrs::likeNum);
        vocab.registerGetter(AttrKey.flag(Flags.LIKE_EMAIL), DefaultLexAttrs::likeEmail);
        vocab.registerGetter(AttrKey.flag(Flags.IS_STOP), s -> stopWords.contains(lower(s)));
        vocab.registerGetter(AttrKey.flag(Flags.IS_OOV), s -> true);
        vocab.registerGetter(AttrKey.flag(Flags.IS_BRACKET), BRACKETS::contains);
        vocab.registerGetter(AttrKey.flag(Flags.IS_QUOTE), QUOTES::contains);
        vocab.registerGetter(AttrKey.flag(Flags.IS_LEFT_PUNCT), LEFT_PUNCT::contains);
        vocab.registerGetter(AttrKey.flag(Flags.IS_RIGHT_PUNCT), RIGHT_PUNCT::contains);
    }

    public static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    public static String prefix(String s) {
        return s.isEmpty() ? "" : s.substring(0, s.offsetByCodePoints(0, 1));
    }

    public static String suffix(String s) {
        int cps = s.codePointCount(0, s.length());
        return cps <= 3 ? s : s.substring(s.offsetByCodePoints(0, cps - 3));
    }

    public static boolean isAlpha(String s) {
        return !s.isEmpty() && s.codePoints().allMatch(Character::isLetter);
    }

    public static boolean isAscii(String s) {
        return s.chars().allMatch(c -> c < 128);
    }

    public static boolean isDigit(String s) {
        return !s.isEmpty() && s.codePoints().allMatch(Character::isDigit);
    }

    public static boolean isSpace(String s) {
        return !s.isEmpty() && s.codePoints().allMatch(Character::isWhitespace);
    }

    public static boolean isPunct(String s) {
        return !s.isEmpty() && s.codePoints().allMatch(DefaultLexAttrs::isPunctChar);
    }

    /**
     * At least one cased character and no uppercase ones.
     */
    public static boolean isLower(String s) {
        boolean cased = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
                return false;
            }
            if (Character.isLowerCase(c)) {
                cased = true;
            }
        }
        return cased;
    }

    public static boolean isUpper(String s) {
        boolean cased = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                cased = true;
            }
        }
        return cased;
    }

    /**
     * Uppercase letters only at the start of a cased run, lowercase letters only after one.
     */
    public static boolean isTitle(String s) {
        boolean cased = false;
        boolean previousCased = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isUpperCase(c) || Character.isTitleCase(c)) {
                if (previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else if (Character.isLowerCase(c)) {
                if (!previousCased) {
                    return false;
                }
                previousCased = true;
                cased = true;
            } else {
                previousCased = false;
            }
        }
        return cased;
    }

    public static boolean likeUrl(String s) {
        if (s.length() < 3) {
            return false;
        }
        if (s.startsWith("http://") || s.startsWith("https://") || s.startsWith("www.")) {
            return true;
        }
        int dot = s.lastIndexOf('.');
        if (dot <= 0 || dot == s.length() - 1 || s.indexOf('@') >= 0) {
            return false;
        }
        String tld = s.substring(dot + 1);
        int slash = tld.indexOf('/');
        if (slash >= 0) {
            tld = tld.substring(0, slash);
        }
        return URL_SUFFIXES.contains(lower(tld));
    }

    /**
     * Digits with optional sign and separators, simple fractions, or number words.
     */
    public static boolean likeNum(String s) {
        String text = s;
        if (text.startsWith("+") || text.startsWith("-") || text.startsWith("~") || text.startsWith("±")) {
            text = text.substring(1);
        }
        String plain = text.replace(",", "").replace(".", "");
        if (isDigit(plain)) {
            return true;
        }
        int slash = text.indexOf('/');
        if (slash > 0 && text.indexOf('/', slash + 1) < 0) {
            if (isDigit(text.substring(0, slash)) && isDigit(text.substring(slash + 1))) {
                return true;
            }
        }
        return NUMBER_WORDS.contains(lower(text));
    }

    public static boolean likeEmail(String s) {
        return EMAIL.matcher(s).matches();
    }

    private static boolean isPunctChar(int cp) {
        switch (Character.getType(cp)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
                return true;
            default:
                return false;
        }
    }
}
