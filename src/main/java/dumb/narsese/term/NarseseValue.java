package dumb.narsese.term;

import dumb.narsese.fold.Folder;
import dumb.narsese.fold.Vocabulary;
import dumb.narsese.lexical.LexicalNarsese;

/**
 * A folded term, sentence or task.
 */
public sealed interface NarseseValue permits Term, Sentence, Task {

    String narsese();

    LexicalNarsese widen();

    /** This value written in another format, such as {@link Vocabulary#LATEX}. */
    default String narsese(Vocabulary vocabulary) {
        return vocabulary.render(Folder.widen(this, vocabulary));
    }

    /** The term carried by this value, which is the value itself for terms. */
    Term term();
}
