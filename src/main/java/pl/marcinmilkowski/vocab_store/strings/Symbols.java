package pl.marcinmilkowski.vocab_store.strings;

import java.util.ArrayList;
import java.util.List;

/**
 * Closed-class strings interned before any lexeme, so they occupy a stable
 * low-numbered id prefix (ids 1..{@link #ALL}.size()).
 *
 * The order is part of the on-disk format: strings.json written by one
 * version must intern to the same ids when read back.
 */
public final class Symbols {

    public static final List<String> ATTRIBUTES = List.of(
        "IS_ALPHA", "IS_ASCII", "IS_DIGIT", "IS_LOWER", "IS_PUNCT", "IS_SPACE",
        "IS_TITLE", "IS_UPPER", "LIKE_URL", "LIKE_NUM", "LIKE_EMAIL", "IS_STOP",
        "IS_OOV", "IS_BRACKET", "IS_QUOTE", "IS_LEFT_PUNCT", "IS_RIGHT_PUNCT",
        "ID", "ORTH", "LOWER", "NORM", "SHAPE", "PREFIX", "SUFFIX", "LENGTH",
        "CLUSTER", "LEMMA", "POS", "TAG", "DEP", "ENT_IOB", "ENT_TYPE", "HEAD",
        "SENTIMENT", "PROB", "LANG"
    );

    public static final List<String> PARTS_OF_SPEECH = List.of(
        "ADJ", "ADP", "ADV", "AUX", "CONJ", "CCONJ", "DET", "INTJ", "NOUN", "NUM",
        "PART", "PRON", "PROPN", "PUNCT", "SCONJ", "SYM", "VERB", "X", "EOL", "SPACE"
    );

    public static final List<String> DEPENDENCIES = List.of(
        "acl", "acomp", "advcl", "advmod", "amod", "appos", "attr", "aux", "auxpass",
        "cc", "ccomp", "compound", "conj", "csubj", "dep", "det", "dobj", "expl",
        "iobj", "mark", "neg", "nmod", "npadvmod", "nsubj", "nsubjpass", "nummod",
        "obj", "obl", "parataxis", "pcomp", "pobj", "poss", "prep", "prt", "punct",
        "relcl", "root", "xcomp"
    );

    public static final List<String> ALL;

    static {
        ArrayList<String> all = new ArrayList<>();
        all.addAll(ATTRIBUTES);
        all.addAll(PARTS_OF_SPEECH);
        all.addAll(DEPENDENCIES);
        ALL = List.copyOf(all);
    }

    private Symbols() {
    }

    /**
     * Interns all symbols in their fixed order.
     */
    public static void internAll(StringStore strings) {
        for (String symbol : ALL) {
            strings.idFor(symbol);
        }
    }
}
